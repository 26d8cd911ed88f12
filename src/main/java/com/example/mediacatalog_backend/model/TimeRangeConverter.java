package com.example.mediacatalog_backend.model;

import com.example.mediacatalog_backend.timerange.TimeRange;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Persists a {@link TimeRange} in its canonical string form. */
@Converter
public class TimeRangeConverter implements AttributeConverter<TimeRange, String> {
    @Override
    public String convertToDatabaseColumn(TimeRange attribute) {
        return attribute == null ? null : attribute.format();
    }

    @Override
    public TimeRange convertToEntityAttribute(String dbData) {
        return dbData == null ? null : TimeRange.parse(dbData);
    }
}
