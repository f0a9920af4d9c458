package com.al.reportmigrator.service.mapping;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.model.ReportParameter;
import com.al.reportmigrator.model.enums.ValueType;
import com.al.reportmigrator.model.target.TargetParameter;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ParameterMapperTest {

    private final ParameterMapper parameterMapper = new ParameterMapper(new ConversionProperties(), new TypeMapper());

    @Test
    public void testMap_DateParameter() {
        TargetParameter parameter = parameterMapper.map(ReportParameter.builder()
                .name("Start Date")
                .valueType(ValueType.DATE)
                .defaultValue("2024-01-01")
                .build());

        assertEquals("P_START_DATE", parameter.getName());
        assertEquals("Start Date", parameter.getSourceName());
        assertEquals("DATE", parameter.getDataType());
        assertEquals(12, parameter.getWidth());
        assertEquals("TO_DATE('2024-01-01', 'YYYY-MM-DD')", parameter.getInitialValue());
        assertEquals("Start Date", parameter.getPromptText());
        assertTrue(parameter.getWarnings().isEmpty());
    }

    @Test
    public void testMap_ListOfValues() {
        TargetParameter parameter = parameterMapper.map(ReportParameter.builder()
                .name("Region")
                .promptText("Pick a region")
                .listOfValues(Arrays.asList("North", "St. John's"))
                .build());

        assertEquals("Pick a region", parameter.getPromptText());
        assertEquals("SELECT 'North' AS value FROM DUAL UNION ALL SELECT 'St. John''s' AS value FROM DUAL",
                parameter.getListOfValues());
        assertNull(parameter.getInitialValue());
    }

    @Test
    public void testMap_MultiValueWarns() {
        TargetParameter parameter = parameterMapper.map(ReportParameter.builder()
                .name("Ids").valueType(ValueType.NUMBER).allowMultiple(true).build());

        assertTrue(parameter.isAllowMultiple());
        assertEquals(1, parameter.getWarnings().size());
        assertTrue(parameter.getWarnings().get(0).contains("multiple values"));
    }

    @Test
    public void testMap_BlankNameRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> parameterMapper.map(ReportParameter.builder().name(" ").build()));
    }
}
