package com.sarkari.jobfeed.scrape.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record NormalizedJobRecord(
    String title,
    String description,
    String department,
    Integer totalPosts,
    String qualification,
    LocalDate notificationDate,
    LocalDate lastDate,
    LocalDate examDate,
    BigDecimal applicationFee,
    BigDecimal salaryMin,
    BigDecimal salaryMax,
    Integer ageMin,
    Integer ageMax,
    String location,
    String state,
    String applicationLink,
    String notificationPdf,
    String sourceUrl,
    String contentHash,
    int qualityScore
) {
    public NormalizedJobRecord withQualityScore(int score) {
        return new NormalizedJobRecord(
            title, description, department, totalPosts, qualification, notificationDate, lastDate, examDate,
            applicationFee, salaryMin, salaryMax, ageMin, ageMax, location, state, applicationLink, notificationPdf,
            sourceUrl, contentHash, score
        );
    }
}
