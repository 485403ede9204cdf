package com.bank.lending.controller;

import com.bank.lending.config.ProductConfig;
import com.bank.lending.config.ScoringConfig;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/config")
@Tag(name = "Config", description = "View the decision policy and loan product configuration (read-only)")
public class ConfigController {

    private final ScoringConfig scoringConfig;
    private final ProductConfig productConfig;

    public ConfigController(ScoringConfig scoringConfig, ProductConfig productConfig) {
        this.scoringConfig = scoringConfig;
        this.productConfig = productConfig;
    }

    @Operation(summary = "Get scoring policy",
            description = "Rules with thresholds and actions, component band tables and penalties, decision bands and offer tiers.")
    @GetMapping("/scoring")
    public ResponseEntity<Map<String, Object>> getScoring() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("scoreFloor", scoringConfig.getScoreFloor());
        body.put("scoreCeiling", scoringConfig.getScoreCeiling());
        body.put("bands", scoringConfig.getBands());
        body.put("rules", scoringConfig.getRules());
        body.put("components", scoringConfig.getComponents());
        body.put("tiers", scoringConfig.getTiers());
        body.put("riskFlags", scoringConfig.getRiskFlags());
        return ResponseEntity.ok(body);
    }

    @Operation(summary = "Get loan product limits and pricing")
    @GetMapping("/product")
    public ResponseEntity<Map<String, Object>> getProduct() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("minLoanAmount", productConfig.getMinLoanAmount());
        body.put("maxLoanAmount", productConfig.getMaxLoanAmount());
        body.put("availableTerms", productConfig.getAvailableTerms());
        body.put("dailyInterestRate", productConfig.getDailyInterestRate());
        body.put("totalCostCap", productConfig.getTotalCostCap());
        body.put("minDisposableBuffer", productConfig.getMinDisposableBuffer());
        body.put("expenseShockBuffer", productConfig.getExpenseShockBuffer());
        return ResponseEntity.ok(body);
    }
}
