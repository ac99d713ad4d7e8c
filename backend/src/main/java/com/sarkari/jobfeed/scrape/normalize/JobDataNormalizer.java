package com.sarkari.jobfeed.scrape.normalize;

import com.sarkari.jobfeed.scrape.error.RecordValidationException;
import com.sarkari.jobfeed.scrape.model.JobField;
import com.sarkari.jobfeed.scrape.model.NormalizedJobRecord;
import com.sarkari.jobfeed.scrape.model.RawJobRecord;
import com.sarkari.jobfeed.scrape.util.HashUtils;
import com.sarkari.jobfeed.scrape.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one extracted field map into a typed record. Pure: no I/O, safe to call from any thread.
 */
@Component
public class JobDataNormalizer {
    public static final int CONTENT_HASH_LENGTH = 16;
    public static final int MIN_TITLE_LENGTH = 10;

    private static final Pattern INTEGER = Pattern.compile("(\\d[\\d,]*)");

    public NormalizedJobRecord normalize(RawJobRecord raw) {
        if (raw == null) {
            throw new RecordValidationException("record", "Raw record is missing");
        }
        String title = TextCleaner.cleanTitle(raw.field(JobField.TITLE.key()));
        if (title == null) {
            throw new RecordValidationException("title", "Required field 'title' is missing or empty");
        }
        String sourceUrl = UrlUtils.normalizeHttpUrl(raw.sourceUrl());
        if (sourceUrl == null) {
            throw new RecordValidationException(
                "source_url",
                "Source URL is missing or lacks an http(s) scheme: '" + raw.sourceUrl() + "'"
            );
        }
        if (title.length() < MIN_TITLE_LENGTH) {
            throw new RecordValidationException("title", "Title too short: '" + title + "'");
        }

        String description = TextCleaner.cleanDescription(raw.field(JobField.DESCRIPTION.key()));
        String department = DepartmentDirectory.expand(raw.field(JobField.DEPARTMENT.key()));
        if (department == null) {
            department = DepartmentDirectory.detectInText(title);
        }
        String location = TextCleaner.clean(raw.field(JobField.LOCATION.key()));
        RangeParser.Range salary = RangeParser.parse(raw.field(JobField.SALARY.key()));
        RangeParser.Range age = RangeParser.parseAge(raw.field(JobField.AGE_LIMIT.key()));

        return new NormalizedJobRecord(
            title,
            description,
            TextCleaner.truncate(department, 255),
            parseInteger(raw.field(JobField.POSTS.key())),
            TextCleaner.clean(raw.field(JobField.QUALIFICATION.key())),
            DateParser.parse(raw.field(JobField.NOTIFICATION_DATE.key())),
            DateParser.parse(raw.field(JobField.LAST_DATE.key())),
            DateParser.parse(raw.field(JobField.EXAM_DATE.key())),
            MoneyParser.parseFee(raw.field(JobField.FEE.key())),
            salary.min(),
            salary.max(),
            age.minAsInt(),
            age.maxAsInt(),
            TextCleaner.truncate(location, 255),
            StateDirectory.detect(location),
            UrlUtils.normalizeHttpUrl(raw.field(JobField.APPLICATION_LINK.key())),
            UrlUtils.normalizeHttpUrl(raw.field(JobField.NOTIFICATION_PDF.key())),
            sourceUrl,
            contentHash(raw),
            0
        );
    }

    /**
     * Dedup key over the five identity fields, cleaned and lower-cased. Empty fields keep their slot so
     * a value cannot shift into a neighbouring position.
     */
    public String contentHash(RawJobRecord raw) {
        String title = TextCleaner.cleanTitle(raw.field(JobField.TITLE.key()));
        String joined = String.join(
            "|",
            TextCleaner.hashComponent(title),
            TextCleaner.hashComponent(TextCleaner.cleanDescription(raw.field(JobField.DESCRIPTION.key()))),
            TextCleaner.hashComponent(raw.field(JobField.LAST_DATE.key())),
            TextCleaner.hashComponent(raw.field(JobField.POSTS.key())),
            TextCleaner.hashComponent(raw.field(JobField.QUALIFICATION.key()))
        );
        return HashUtils.sha256Prefix(joined, CONTENT_HASH_LENGTH);
    }

    static Integer parseInteger(String raw) {
        if (raw == null) {
            return null;
        }
        Matcher matcher = INTEGER.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1).replace(",", ""));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
