package com.clinicbooking.bookingservice.util;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Stores timestamps as {@code yyyy-MM-dd HH:mm:ss} text so SQLite compares them in
 * chronological order.
 */
@Converter(autoApply = true)
public class LocalDateTimeConverter implements AttributeConverter<LocalDateTime, String> {

    private static final Logger logger = LoggerFactory.getLogger(LocalDateTimeConverter.class);

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public String convertToDatabaseColumn(LocalDateTime localDateTime) {
        if (localDateTime == null) {
            return null;
        }
        return localDateTime.withNano(0).format(FORMATTER);
    }

    @Override
    public LocalDateTime convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(dbData, FORMATTER);
        } catch (DateTimeParseException e) {
            // rows written by other tools may use the ISO 'T' separator
            try {
                return LocalDateTime.parse(dbData.trim().replace(' ', 'T'));
            } catch (DateTimeParseException e2) {
                logger.error("[LocalDateTimeConverter] Unreadable timestamp '{}': {}", dbData, e2.getMessage());
                throw new IllegalStateException("Unreadable timestamp in database: " + dbData, e2);
            }
        }
    }
}
