package com.example.musictaste.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI musicTasteOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Music Taste API")
                        .description("歌曲推荐、热门趋势与口味匹配度接口文档")
                        .version("v1")
                        .contact(new Contact().name("music-taste")));
    }
}
