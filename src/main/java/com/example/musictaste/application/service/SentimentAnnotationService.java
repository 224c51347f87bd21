package com.example.musictaste.application.service;

import com.example.musictaste.common.exception.BusinessException;
import com.example.musictaste.common.exception.ErrorCodes;
import com.example.musictaste.domain.model.SentimentAnnotation;
import com.example.musictaste.domain.model.SongReview;
import com.example.musictaste.domain.sentiment.ReviewSentimentAnalyzer;
import com.example.musictaste.infrastructure.persistence.MusicTasteStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class SentimentAnnotationService {

    private static final Logger log = LoggerFactory.getLogger(SentimentAnnotationService.class);

    private final MusicTasteStore store;
    private final ReviewSentimentAnalyzer analyzer;

    public SentimentAnnotationService(MusicTasteStore store, ReviewSentimentAnalyzer analyzer) {
        this.store = store;
        this.analyzer = analyzer;
    }

    /**
     * Analyzes the review text and overwrites the review's stored annotation.
     */
    public SentimentAnnotation annotate(Long reviewId) {
        if (reviewId == null || reviewId <= 0) {
            throw new BusinessException(ErrorCodes.BAD_REQUEST, "reviewId不合法");
        }
        try {
            SongReview review = store.getReview(reviewId)
                    .orElseThrow(() -> new BusinessException(ErrorCodes.NOT_FOUND, "评论不存在"));
            SentimentAnnotation annotation = analyzer.analyze(review.getText());
            store.upsertSentiment(reviewId, annotation);
            log.info("SENTIMENT_EVENT event=annotated reviewId={} sentiment={} toxicity={} emotions={}",
                    reviewId, annotation.getSentiment(), annotation.getToxicity(), annotation.getEmotions());
            return annotation;
        } catch (DataAccessException e) {
            log.warn("SENTIMENT_EVENT event=annotate_failure reviewId={} cause={}",
                    reviewId, e.getClass().getSimpleName());
            throw new BusinessException(ErrorCodes.SENTIMENT_UNAVAILABLE, "情感分析暂时不可用",
                    ErrorCodes.RETRY_LATER, e);
        }
    }
}
