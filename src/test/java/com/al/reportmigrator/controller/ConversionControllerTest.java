package com.al.reportmigrator.controller;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.dto.BatchTransformationResponse;
import com.al.reportmigrator.dto.ConversionStatistics;
import com.al.reportmigrator.dto.TransformedReport;
import com.al.reportmigrator.exception.GlobalExceptionHandler;
import com.al.reportmigrator.model.enums.ConversionOutcome;
import com.al.reportmigrator.service.BatchTransformationService;
import com.al.reportmigrator.service.ReportTransformationService;
import com.al.reportmigrator.service.expression.ExpressionTranslator;
import com.al.reportmigrator.service.mapping.TypeMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class ConversionControllerTest {

    private MockMvc mockMvc;

    @Mock
    private ReportTransformationService transformationService;

    @Mock
    private BatchTransformationService batchTransformationService;

    private ConversionProperties properties;
    private AutoCloseable mocks;

    @BeforeEach
    public void setup() {
        mocks = MockitoAnnotations.openMocks(this);
        properties = new ConversionProperties();
        ConversionController controller = new ConversionController(transformationService,
                batchTransformationService, new ExpressionTranslator(properties, new TypeMapper()));

        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @AfterEach
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    public void testConvertExpression_Success() throws Exception {
        mockMvc.perform(post("/api/convert/expression")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Order Total\",\"expression\":\"{orders.amount} * 2\",\"returnType\":\"NUMBER\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.targetName").value("CF_ORDER_TOTAL"))
                .andExpect(jsonPath("$.targetExpression").value(":AMOUNT * 2"))
                .andExpect(jsonPath("$.targetReturnType").value("NUMBER"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.outcome").value("CONVERTED"));
    }

    @Test
    public void testConvertExpression_MissingName() throws Exception {
        mockMvc.perform(post("/api/convert/expression")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"expression\":\"1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"))
                .andExpect(jsonPath("$.path").value("/api/convert/expression"));
    }

    @Test
    public void testConvertExpression_RefusedUnderFailPolicy() throws Exception {
        properties.setOnUnsupportedFormula(ConversionProperties.UnsupportedPolicy.FAIL);

        mockMvc.perform(post("/api/convert/expression")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Odd\",\"expression\":\"Frobnicate(1)\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Unsupported Expression"))
                .andExpect(jsonPath("$.element").value("Odd"));
    }

    @Test
    public void testConvertReport_Success() throws Exception {
        ConversionStatistics statistics = new ConversionStatistics();
        statistics.record(ConversionOutcome.CONVERTED);
        when(transformationService.transform(any()))
                .thenReturn(TransformedReport.builder().name("Sales").statistics(statistics).build());

        mockMvc.perform(post("/api/convert/report")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Sales\",\"groups\":[{\"name\":\"Region\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Sales"))
                .andExpect(jsonPath("$.status").value("SUCCESS"));
    }

    @Test
    public void testConvertReport_MalformedJson() throws Exception {
        mockMvc.perform(post("/api/convert/report")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("JSON Processing Error"))
                .andExpect(jsonPath("$.element").doesNotExist());

        verify(transformationService, never()).transform(any());
    }

    @Test
    public void testConvertReport_InvalidDefinition() throws Exception {
        when(transformationService.transform(any())).thenThrow(new IllegalArgumentException("Bad page size"));

        mockMvc.perform(post("/api/convert/report")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Sales\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details").value("Bad page size"));
    }

    @Test
    public void testConvertBatch_Success() throws Exception {
        BatchTransformationResponse response = new BatchTransformationResponse();
        response.setTotalReports(2);
        response.setSuccessCount(2);
        when(batchTransformationService.transformBatch(anyList())).thenReturn(response);

        mockMvc.perform(post("/api/convert/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reports\":[{\"name\":\"A\"},{\"name\":\"B\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalReports").value(2))
                .andExpect(jsonPath("$.successCount").value(2));
    }

    @Test
    public void testConvertBatch_EmptyRejected() throws Exception {
        mockMvc.perform(post("/api/convert/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reports\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"));

        verify(batchTransformationService, never()).transformBatch(anyList());
    }
}
