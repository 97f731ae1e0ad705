package com.example.apistress.web;

import com.example.apistress.clients.HttpMethod;
import com.example.apistress.config.ConfigurationException;
import com.example.apistress.config.StressTestConfig;
import com.example.apistress.dto.RunSubmissionRequest;
import java.time.Duration;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;
import org.mapstruct.Named;
import org.mapstruct.NullValueCheckStrategy;

/** Copies the fields present on a submission onto a builder already holding the configured defaults. */
@Mapper(componentModel = "spring", nullValueCheckStrategy = NullValueCheckStrategy.ALWAYS)
public interface RunMapper {

    @Mapping(target = "method", source = "method", qualifiedByName = "mapMethod")
    @Mapping(target = "timeout", source = "timeoutSeconds", qualifiedByName = "mapTimeout")
    void applyOverrides(RunSubmissionRequest request, @MappingTarget StressTestConfig.StressTestConfigBuilder builder);

    @Named("mapMethod")
    default HttpMethod mapMethod(String method) {
        try {
            return HttpMethod.fromValue(method);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ex.getMessage());
        }
    }

    @Named("mapTimeout")
    default Duration mapTimeout(Double timeoutSeconds) {
        return StressTestConfig.timeoutOfSeconds(timeoutSeconds);
    }
}
