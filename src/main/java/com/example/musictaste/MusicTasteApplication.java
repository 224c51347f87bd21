package com.example.musictaste;

import com.example.musictaste.common.config.AppCompatibilityProperties;
import com.example.musictaste.common.config.AppRecommendationProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@MapperScan("com.example.musictaste.infrastructure.persistence.mapper")
@EnableConfigurationProperties({
        AppRecommendationProperties.class,
        AppCompatibilityProperties.class
})
public class MusicTasteApplication {

    public static void main(String[] args) {
        SpringApplication.run(MusicTasteApplication.class, args);
    }
}
