package com.campus.timetable.validation;

import com.campus.timetable.validation.ScheduleRequestValidator.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

public class InvalidScheduleRequestException extends RuntimeException {
    private final List<ValidationError> errors;

    public InvalidScheduleRequestException(List<ValidationError> errors) {
        super("Invalid schedule request: " + errors.stream().map(ValidationError::message).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
