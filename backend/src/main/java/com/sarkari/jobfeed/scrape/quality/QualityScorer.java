package com.sarkari.jobfeed.scrape.quality;

import com.sarkari.jobfeed.scrape.model.JobField;
import com.sarkari.jobfeed.scrape.model.RawJobRecord;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class QualityScorer {
    public static final int HIGH_QUALITY_THRESHOLD = 70;
    public static final int MAX_SCORE = 100;

    private static final int BONUS_PER_FIELD = 2;
    private static final int MAX_BONUS = 10;
    private static final int MIN_SCORING_LENGTH = 4;
    private static final Map<String, Integer> WEIGHTS = new LinkedHashMap<>();

    static {
        WEIGHTS.put(JobField.TITLE.key(), 20);
        WEIGHTS.put(JobField.DESCRIPTION.key(), 15);
        WEIGHTS.put(JobField.LAST_DATE.key(), 15);
        WEIGHTS.put(JobField.NOTIFICATION_DATE.key(), 10);
        WEIGHTS.put(JobField.POSTS.key(), 10);
        WEIGHTS.put(JobField.QUALIFICATION.key(), 10);
        WEIGHTS.put(JobField.SALARY.key(), 8);
        WEIGHTS.put(JobField.AGE_LIMIT.key(), 7);
        WEIGHTS.put(JobField.DEPARTMENT.key(), 5);
    }

    public int score(RawJobRecord record) {
        if (record == null) {
            return 0;
        }
        int score = 0;
        for (Map.Entry<String, Integer> weight : WEIGHTS.entrySet()) {
            String value = record.field(weight.getKey());
            if (value != null && value.trim().length() >= MIN_SCORING_LENGTH) {
                score += weight.getValue();
            }
        }
        int extras = 0;
        for (Map.Entry<String, String> field : record.fields().entrySet()) {
            if (WEIGHTS.containsKey(field.getKey())) {
                continue;
            }
            if (field.getValue() != null && !field.getValue().isBlank()) {
                extras++;
            }
        }
        score += Math.min(MAX_BONUS, extras * BONUS_PER_FIELD);
        return Math.min(MAX_SCORE, Math.max(0, score));
    }

    public boolean isHighQuality(int score) {
        return score >= HIGH_QUALITY_THRESHOLD;
    }
}
