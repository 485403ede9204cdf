package com.bank.lending.controller;

import com.bank.lending.config.ProductConfig;
import com.bank.lending.config.ScoringConfig;
import com.bank.lending.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScoringConfig scoringConfig;

    @MockBean
    private ProductConfig productConfig;

    @Test
    void getScoring_success() throws Exception {
        ScoringConfig policy = TestDataFactory.createScoringConfig();
        when(scoringConfig.getScoreFloor()).thenReturn(0.0);
        when(scoringConfig.getScoreCeiling()).thenReturn(100.0);
        when(scoringConfig.getBands()).thenReturn(policy.getBands());
        when(scoringConfig.getRules()).thenReturn(policy.getRules());
        when(scoringConfig.getComponents()).thenReturn(policy.getComponents());
        when(scoringConfig.getTiers()).thenReturn(policy.getTiers());
        when(scoringConfig.getRiskFlags()).thenReturn(policy.getRiskFlags());

        mockMvc.perform(get("/api/v1/config/scoring"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bands.approveMin").value(70.0))
                .andExpect(jsonPath("$.bands.referMin").value(45.0))
                .andExpect(jsonPath("$.rules.length()").value(10))
                .andExpect(jsonPath("$.rules[2].type").value("MAX_ACTIVE_HCSTC_LENDERS"))
                .andExpect(jsonPath("$.rules[2].action").value("DECLINE"))
                .andExpect(jsonPath("$.components[0].type").value("AFFORDABILITY"))
                .andExpect(jsonPath("$.components[0].subScores['debt-to-income'].direction").value("LOWER_IS_BETTER"))
                .andExpect(jsonPath("$.tiers[0].maxAmount").value(1500.0));
    }

    @Test
    void getProduct_success() throws Exception {
        when(productConfig.getMinLoanAmount()).thenReturn(200.0);
        when(productConfig.getMaxLoanAmount()).thenReturn(1500.0);
        when(productConfig.getAvailableTerms()).thenReturn(List.of(3, 4, 5, 6));
        when(productConfig.getDailyInterestRate()).thenReturn(0.008);
        when(productConfig.getTotalCostCap()).thenReturn(1.0);
        when(productConfig.getMinDisposableBuffer()).thenReturn(50.0);
        when(productConfig.getExpenseShockBuffer()).thenReturn(1.1);

        mockMvc.perform(get("/api/v1/config/product"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.minLoanAmount").value(200.0))
                .andExpect(jsonPath("$.maxLoanAmount").value(1500.0))
                .andExpect(jsonPath("$.availableTerms[3]").value(6))
                .andExpect(jsonPath("$.dailyInterestRate").value(0.008))
                .andExpect(jsonPath("$.totalCostCap").value(1.0));
    }
}
