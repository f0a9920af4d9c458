package com.al.reportmigrator.service.expression;

import com.al.reportmigrator.config.ConversionProperties;
import com.al.reportmigrator.exception.UnsupportedExpressionException;
import com.al.reportmigrator.model.Formula;
import com.al.reportmigrator.model.enums.ConversionOutcome;
import com.al.reportmigrator.model.enums.ValueType;
import com.al.reportmigrator.model.target.TranslatedExpression;
import com.al.reportmigrator.service.mapping.TypeMapper;
import com.al.reportmigrator.util.TargetNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Translates source formulas into target functions.
 * <p>
 * Translation never throws for malformed input unless the unsupported-formula
 * policy is FAIL. Under PLACEHOLDER a structurally broken formula becomes a
 * stub function documenting the original text; under SKIP it is reported as
 * failed with no code.
 *
 * @author Report Migrator Team
 * @version 1.0.0
 * @since 1.0.0
 */
@Slf4j
@Service
public class ExpressionTranslator {

    private static final String NULL_FALLBACK = "NULL";
    private static final String BOOLEAN_FALLBACK = "FALSE";

    private final ConversionProperties properties;
    private final TypeMapper typeMapper;
    private final RewritePipeline pipeline;

    public ExpressionTranslator(ConversionProperties properties, TypeMapper typeMapper) {
        this.properties = properties;
        this.typeMapper = typeMapper;
        this.pipeline = RewritePipeline.standard(properties);
    }

    public TranslatedExpression translate(Formula formula) {
        return translate(formula.getName(), formula.getExpression(), formula.getReturnType());
    }

    public TranslatedExpression translate(String name, String expression, ValueType returnType) {
        return translateAs(name, TargetNames.formulaName(properties.getFormulaPrefix(), name), expression, returnType);
    }

    /**
     * Translate under an explicit target name, e.g. one already deduplicated
     * by the caller.
     */
    public TranslatedExpression translateAs(String sourceName, String targetName, String expression,
                                            ValueType returnType) {
        ValueType type = returnType == null ? ValueType.STRING : returnType;
        String targetType = typeMapper.mapType(type).getName();
        return translateInternal(sourceName, targetName, expression, targetType,
                type == ValueType.BOOLEAN, NULL_FALLBACK, List.of());
    }

    /**
     * Translate a boolean condition into a function returning BOOLEAN, with
     * FALSE as the fallback value.
     */
    public TranslatedExpression translateCondition(String sourceName, String targetName, String condition,
                                                   List<String> headerComments) {
        return translateInternal(sourceName, targetName, condition, "BOOLEAN", false, BOOLEAN_FALLBACK,
                headerComments);
    }

    /**
     * Translate every formula of a report. Target names that collide after
     * sanitising get a numeric suffix. Under the FAIL policy a refused formula
     * is returned as a failed result so the others still get translated.
     */
    public List<TranslatedExpression> translateAll(List<Formula> formulas) {
        List<TranslatedExpression> results = new ArrayList<>();
        Set<String> usedNames = new HashSet<>();
        for (Formula formula : formulas) {
            String base = TargetNames.formulaName(properties.getFormulaPrefix(), formula.getName());
            String targetName = base;
            int suffix = 2;
            while (!usedNames.add(targetName)) {
                targetName = base + "_" + suffix++;
            }
            if (!targetName.equals(base)) {
                log.warn("Formula '{}' renamed to {} to avoid a name clash", formula.getName(), targetName);
            }
            try {
                results.add(translateAs(formula.getName(), targetName, formula.getExpression(),
                        formula.getReturnType()));
            } catch (UnsupportedExpressionException e) {
                log.warn("Formula '{}' refused: {}", formula.getName(), e.getMessage());
                results.add(TranslatedExpression.builder()
                        .sourceName(formula.getName())
                        .targetName(targetName)
                        .targetCode("")
                        .targetReturnType(typeMapper.mapType(formula.getReturnType()).getName())
                        .success(false)
                        .outcome(ConversionOutcome.FAILED)
                        .warning(e.getMessage())
                        .build());
            }
        }

        long converted = results.stream().filter(r -> r.getOutcome() == ConversionOutcome.CONVERTED).count();
        long withWarnings = results.stream()
                .filter(r -> r.getOutcome() == ConversionOutcome.CONVERTED_WITH_WARNING).count();
        long placeholders = results.stream().filter(TranslatedExpression::isPlaceholder).count();
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        log.info("Formula translation: {} converted, {} with warnings, {} placeholders, {} failed",
                converted, withWarnings, placeholders, failed);
        return results;
    }

    private TranslatedExpression translateInternal(String sourceName, String targetName, String expression,
                                                   String returnType, boolean wrapBoolean, String fallback,
                                                   List<String> headerComments) {
        log.debug("Translating {} as {}", sourceName, targetName);

        if (expression == null || expression.isBlank()) {
            GeneratedFunction function = GeneratedFunction.builder()
                    .name(targetName)
                    .returnType(returnType)
                    .expression(BOOLEAN_FALLBACK.equals(fallback) ? BOOLEAN_FALLBACK : NULL_FALLBACK)
                    .fallbackValue(fallback)
                    .headerComments(headerComments)
                    .build();
            return TranslatedExpression.builder()
                    .sourceName(sourceName)
                    .targetName(targetName)
                    .targetCode(function.render())
                    .targetExpression(function.getExpression())
                    .targetReturnType(returnType)
                    .success(true)
                    .outcome(ConversionOutcome.CONVERTED)
                    .warning("Empty expression converted to " + function.getExpression())
                    .build();
        }

        String normalized = expression.replace("\r\n", "\n").replace('\r', '\n').trim();
        Optional<String> problem = SourceScanner.structuralProblem(normalized);
        if (problem.isPresent()) {
            return unsupported(sourceName, targetName, normalized, returnType, fallback, problem.get(), null);
        }

        RewriteState state;
        try {
            state = pipeline.run(normalized);
        } catch (RuntimeException e) {
            log.warn("Failed to translate {}: {}", sourceName, e.getMessage());
            return unsupported(sourceName, targetName, normalized, returnType, fallback, e.getMessage(), e);
        }

        if (state.hasIssues() && properties.isFailHard()) {
            throw new UnsupportedExpressionException(sourceName, String.join("; ", state.getIssues()));
        }

        String body = wrapBoolean ? "CASE WHEN " + state.getText() + " THEN 'Y' ELSE 'N' END" : state.getText();
        GeneratedFunction function = GeneratedFunction.builder()
                .name(targetName)
                .returnType(returnType)
                .expression(body)
                .fallbackValue(fallback)
                .headerComments(headerComments)
                .build();

        state.getWarnings().forEach(w -> log.debug("{}: {}", sourceName, w));
        return TranslatedExpression.builder()
                .sourceName(sourceName)
                .targetName(targetName)
                .targetCode(function.render())
                .targetExpression(body)
                .targetReturnType(returnType)
                .success(true)
                .outcome(state.getWarnings().isEmpty()
                        ? ConversionOutcome.CONVERTED
                        : ConversionOutcome.CONVERTED_WITH_WARNING)
                .warnings(state.getWarnings())
                .referencedColumns(state.getReferencedColumns())
                .referencedFormulas(state.getReferencedFormulas())
                .referencedParameters(state.getReferencedParameters())
                .build();
    }

    private TranslatedExpression unsupported(String sourceName, String targetName, String expression,
                                             String returnType, String fallback, String reason,
                                             RuntimeException cause) {
        switch (properties.getOnUnsupportedFormula()) {
            case FAIL:
                throw cause == null
                        ? new UnsupportedExpressionException(sourceName, reason)
                        : new UnsupportedExpressionException(sourceName, reason, cause);
            case SKIP:
                log.warn("Skipping {}: {}", sourceName, reason);
                return TranslatedExpression.builder()
                        .sourceName(sourceName)
                        .targetName(targetName)
                        .targetCode("")
                        .targetReturnType(returnType)
                        .success(false)
                        .outcome(ConversionOutcome.FAILED)
                        .warning("Skipped: " + reason)
                        .build();
            case PLACEHOLDER:
            default:
                log.warn("Placeholder generated for {}: {}", sourceName, reason);
                GeneratedFunction stub = GeneratedFunction.builder()
                        .name(targetName)
                        .returnType(returnType)
                        .fallbackValue(fallback)
                        .placeholder(true)
                        .reason(reason)
                        .originalText(expression)
                        .build();
                return TranslatedExpression.builder()
                        .sourceName(sourceName)
                        .targetName(targetName)
                        .targetCode(stub.render())
                        .targetReturnType(returnType)
                        .success(true)
                        .placeholder(true)
                        .outcome(ConversionOutcome.CONVERTED_WITH_WARNING)
                        .warning("Created placeholder - manual conversion required: " + reason)
                        .build();
        }
    }
}
