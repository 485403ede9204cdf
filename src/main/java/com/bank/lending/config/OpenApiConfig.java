package com.bank.lending.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI loanDecisionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Loan Decision Engine API")
                        .version("1.0.0")
                        .description(
                                "Affordability and decision engine for short-term consumer loans, driven by bank transaction history.\n\n" +
                                "**Assessment Pipeline:**\n" +
                                "1. Submit an application via `POST /api/v1/assessments`\n" +
                                "2. Classify each transaction: strict taxonomy, whitelist, behavioral income detection, pattern tables, fallback\n" +
                                "3. Aggregate income, expense, debt, affordability, balance and risk metrics over the trailing window\n" +
                                "4. Apply decline and refer rules, then score four components (0-100)\n" +
                                "5. Decide: **APPROVE** (>=70), **REFER** (45-69), **DECLINE** (<45), with a loan offer for approvals\n\n" +
                                "**Amounts:** negative = money in (credit), positive = money out (debit).\n\n" +
                                "Every response carries the per-transaction classification audit.")
                        .contact(new Contact().name("Lending Decisioning Team")));
    }
}
