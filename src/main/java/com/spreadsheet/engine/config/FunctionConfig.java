package com.spreadsheet.engine.config;

import com.spreadsheet.engine.formula.functions.DomainLookupFunction;
import com.spreadsheet.engine.services.LookupTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Domain lookup functions. Their data comes from {@link LookupTable};
 * the lambdas give the text shown while that data is missing.
 */
@Configuration
public class FunctionConfig {

    @Bean
    public DomainLookupFunction analystFunction(LookupTable lookupTable) {
        return new DomainLookupFunction("ANALYST", 1, lookupTable, symbol -> "Analyzing " + symbol + "...");
    }

    @Bean
    public DomainLookupFunction oracleFunction(LookupTable lookupTable) {
        return new DomainLookupFunction("ORACLE", 1, lookupTable, symbol -> "Oracle analyzing " + symbol + "...");
    }

    @Bean
    public DomainLookupFunction portfolioFunction(LookupTable lookupTable) {
        return new DomainLookupFunction("PORTFOLIO", 1, lookupTable, metric -> "N/A");
    }

    @Bean
    public DomainLookupFunction bidFunction(LookupTable lookupTable) {
        return new DomainLookupFunction("BID", 1, lookupTable, symbol -> "Pricing " + symbol + "...");
    }

    @Bean
    public DomainLookupFunction tradebotFunction(LookupTable lookupTable) {
        return new DomainLookupFunction("TRADEBOT", 2, lookupTable, bot -> "N/A");
    }
}
