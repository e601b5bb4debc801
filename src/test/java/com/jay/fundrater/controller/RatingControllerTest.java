package com.jay.fundrater.controller;

import com.jay.fundrater.config.RaterConfig;
import com.jay.fundrater.layer4_rating.RuleCatalog;
import com.jay.fundrater.layer5_report.RatingReportGenerator;
import com.jay.fundrater.layer6_service.TickerRatingService;
import com.jay.fundrater.model.TickerDataset;
import com.jay.fundrater.model.TickerRatingView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RatingControllerTest {

    private TickerRatingService ratingService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ratingService = mock(TickerRatingService.class);
        mvc = MockMvcBuilders
            .standaloneSetup(new RatingController(new RaterConfig(), ratingService, new RatingReportGenerator()))
            .build();
    }

    @Test
    void rate_returnsTheView() throws Exception {
        when(ratingService.rate(any(TickerDataset.class)))
            .thenReturn(Optional.of(TickerRatingView.builder().ticker("ACME").companyName("Acme").build()));

        mvc.perform(post("/api/ratings").contentType(MediaType.APPLICATION_JSON)
                .content("{\"ticker\":\"ACME\",\"periods\":[{\"periodEnd\":\"2024-12-31\",\"revenue\":10}]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ticker").value("ACME"))
            .andExpect(jsonPath("$.companyName").value("Acme"));
    }

    @Test
    void rate_blankTickerIsABadRequest() throws Exception {
        mvc.perform(post("/api/ratings").contentType(MediaType.APPLICATION_JSON).content("{\"ticker\":\" \"}"))
            .andExpect(status().isBadRequest());

        verify(ratingService, never()).rate(any());
    }

    @Test
    void rate_noUsablePeriodsIsNotFound() throws Exception {
        when(ratingService.rate(any(TickerDataset.class))).thenReturn(Optional.empty());

        mvc.perform(post("/api/ratings").contentType(MediaType.APPLICATION_JSON).content("{\"ticker\":\"ACME\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    void rateBatch_returnsEveryView() throws Exception {
        when(ratingService.rateBatch(anyList())).thenReturn(List.of(
            TickerRatingView.builder().ticker("AAA").build(),
            TickerRatingView.builder().ticker("BBB").errorMessage("Rating timed out after 30s").build()));

        mvc.perform(post("/api/ratings/batch").contentType(MediaType.APPLICATION_JSON)
                .content("[{\"ticker\":\"AAA\"},{\"ticker\":\"BBB\"}]"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(2))
            .andExpect(jsonPath("$[1].errorMessage").value("Rating timed out after 30s"));
    }

    @Test
    void rateStored_unknownTickerIsNotFound() throws Exception {
        when(ratingService.rateStored("NOPE")).thenReturn(Optional.empty());

        mvc.perform(get("/api/ratings/NOPE")).andExpect(status().isNotFound());
    }

    @Test
    void report_isPlainText() throws Exception {
        when(ratingService.rateStored("ACME")).thenReturn(Optional.of(
            TickerRatingView.builder().ticker("ACME").errorMessage("Rating failed: boom").build()));

        mvc.perform(get("/api/ratings/ACME/report"))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
            .andExpect(content().string(containsString("TICKER            :  ACME")))
            .andExpect(content().string(containsString("Rating failed: boom")));
    }

    @Test
    void status_reportsConfiguration() throws Exception {
        when(ratingService.storedTickers()).thenReturn(List.of("AAA", "BBB"));

        mvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("RUNNING"))
            .andExpect(jsonPath("$.ruleCatalogVersion").value(RuleCatalog.VERSION))
            .andExpect(jsonPath("$.storedTickers").value(2))
            .andExpect(jsonPath("$.scannerVersion").value("3"));
    }
}
