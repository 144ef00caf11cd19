package com.sheetcalc.app.config;

import com.sheetcalc.app.engine.SheetEvaluator;
import com.sheetcalc.app.formula.FormulaCache;
import com.sheetcalc.app.functions.FunctionRegistry;
import com.sheetcalc.app.serialization.SheetDocCodec;
import com.sheetcalc.app.serialization.SheetTextSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the formula engine and the serializers from {@link EngineProperties}.
 */
@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public Clock engineClock(EngineProperties properties) {
        return Clock.system(ZoneId.of(properties.getTimeZone()));
    }

    @Bean
    public FunctionRegistry functionRegistry(Clock engineClock) {
        return FunctionRegistry.withDefaults(engineClock);
    }

    @Bean
    public FormulaCache formulaCache(EngineProperties properties) {
        return new FormulaCache(properties.getParseCacheSize());
    }

    @Bean
    public SheetEvaluator sheetEvaluator(FormulaCache formulaCache, FunctionRegistry functionRegistry,
                                         EngineProperties properties) {
        log.info("Formula engine ready: {} functions, parse cache {}, max range {} cells",
                functionRegistry.names().size(), properties.getParseCacheSize(), properties.getMaxRangeCells());
        return new SheetEvaluator(formulaCache, functionRegistry, properties.getMaxRangeCells());
    }

    @Bean
    public SheetTextSerializer sheetTextSerializer() {
        return new SheetTextSerializer();
    }

    @Bean
    public SheetDocCodec sheetDocCodec() {
        return new SheetDocCodec(SheetDocCodec.defaultMapper());
    }
}
