package com.datafetch.domain.model;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FetchRequestTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    private static FetchRequest.FetchRequestBuilder valid() {
        return FetchRequest.builder()
                .refs(List.of("b", "a", "b"))
                .axis(AxisMapping.builder().x("time").y("temperature").z("").color("").build())
                .startDt(Instant.parse("2020-01-01T00:00:00Z"))
                .endDt(Instant.parse("2020-01-01T01:00:00Z"));
    }

    @Test
    void testValidRequest() {
        assertThat(validator.validate(valid().build())).isEmpty();
    }

    @Test
    void testEmptyRefsRejected() {
        Set<ConstraintViolation<FetchRequest>> violations = validator.validate(valid().refs(List.of()).build());

        assertThat(violations).extracting(v -> v.getPropertyPath().toString()).contains("refs");
    }

    @Test
    void testBlankAxisRejected() {
        FetchRequest request = valid().axis(AxisMapping.builder().x("time").y(" ").build()).build();

        assertThat(validator.validate(request)).extracting(v -> v.getPropertyPath().toString()).contains("axis.y");
    }

    @Test
    void testInvertedTimeRangeRejected() {
        FetchRequest request = valid()
                .startDt(Instant.parse("2020-01-02T00:00:00Z"))
                .endDt(Instant.parse("2020-01-01T00:00:00Z"))
                .build();

        assertThat(validator.validate(request)).extracting(ConstraintViolation::getMessage)
                .contains("startDt must be before endDt");
    }

    @Test
    void testDatasetIdsDistinctInArrivalOrder() {
        assertThat(valid().build().datasetIds()).containsExactly("b", "a");
    }

    @Test
    void testVariableProjectionAlwaysIncludesTime() {
        AxisMapping axis = AxisMapping.builder().x("salinity").y("temperature").z("").color("pressure").build();

        assertThat(axis.variableProjection()).containsExactly("salinity", "temperature", "pressure", "time");
    }
}
