package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.model.ReportParameter;
import com.al.reportmigrator.model.enums.ValueType;
import com.al.reportmigrator.model.target.TargetParameter;
import com.al.reportmigrator.util.TargetNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps user parameters to target parameters.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParameterMapper {

    private final ConversionProperties properties;
    private final TypeMapper typeMapper;

    public TargetParameter map(ReportParameter parameter) {
        if (parameter.getName() == null || parameter.getName().isBlank()) {
            throw new IllegalArgumentException("Parameter without a name");
        }
        ValueType type = parameter.getValueType() == null ? ValueType.STRING : parameter.getValueType();
        TargetParameter.TargetParameterBuilder builder = TargetParameter.builder()
                .sourceName(parameter.getName())
                .name(TargetNames.parameterName(properties.getParameterPrefix(), parameter.getName()))
                .dataType(typeMapper.mapType(type).getDeclaration())
                .width(displayWidth(type))
                .promptText(parameter.getPromptText() == null || parameter.getPromptText().isBlank()
                        ? parameter.getName()
                        : parameter.getPromptText())
                .allowMultiple(parameter.isAllowMultiple());

        if (parameter.getDefaultValue() != null) {
            builder.initialValue(typeMapper.defaultValueLiteral(type, parameter.getDefaultValue()));
        }
        if (parameter.getListOfValues() != null && !parameter.getListOfValues().isEmpty()) {
            builder.listOfValues(listOfValuesQuery(parameter.getListOfValues()));
        }
        if (parameter.isAllowMultiple()) {
            builder.warning("Parameter '" + parameter.getName()
                    + "' accepts multiple values; queries must reference it as a lexical parameter");
        }
        if (type == ValueType.UNKNOWN) {
            builder.warning("Parameter '" + parameter.getName() + "' has an unknown type; mapped as text");
        }
        return builder.build();
    }

    /**
     * Display width by type.
     */
    int displayWidth(ValueType type) {
        switch (type) {
            case NUMBER:
            case CURRENCY:
                return 15;
            case DATE:
                return 12;
            case TIME:
                return 10;
            case DATETIME:
                return 22;
            case BOOLEAN:
                return 5;
            case MEMO:
                return 60;
            default:
                return 30;
        }
    }

    /**
     * Static pick list as a UNION ALL of single-row selects.
     */
    String listOfValuesQuery(List<String> values) {
        return values.stream()
                .map(v -> "SELECT '" + String.valueOf(v).replace("'", "''") + "' AS value FROM DUAL")
                .collect(Collectors.joining(" UNION ALL "));
    }
}
