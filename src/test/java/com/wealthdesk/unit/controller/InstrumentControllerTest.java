package com.wealthdesk.unit.controller;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.wealthdesk.api.controller.InstrumentController;
import com.wealthdesk.catalog.InstrumentCatalog;
import com.wealthdesk.config.ApiResponseAdvice;
import com.wealthdesk.domain.enums.AssetClass;
import com.wealthdesk.domain.model.Instrument;
import com.wealthdesk.exception.GlobalExceptionHandler;
import com.wealthdesk.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class InstrumentControllerTest {

    @Mock
    private InstrumentCatalog instrumentCatalog;

    private MockMvc mockMvc;
    private Instrument etf;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new InstrumentController(instrumentCatalog))
                .setControllerAdvice(new ApiResponseAdvice(), new GlobalExceptionHandler())
                .build();
        etf = Instrument.builder()
                .id("ins-1")
                .symbol("SPY")
                .name("SPDR S&P 500 ETF")
                .assetClass(AssetClass.EQUITY)
                .riskRating(4)
                .currentPrice(new BigDecimal("450.25"))
                .build();
    }

    @Test
    void listInstruments_returnsCatalog() throws Exception {
        when(instrumentCatalog.findAll()).thenReturn(List.of(etf));

        mockMvc.perform(get("/api/instruments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].symbol").value("SPY"))
                .andExpect(jsonPath("$.data[0].requiredRiskScore").value(4));
    }

    @Test
    void getInstrument_unknown_returns404() throws Exception {
        when(instrumentCatalog.get("nope")).thenThrow(new ResourceNotFoundException("Instrument", "nope"));

        mockMvc.perform(get("/api/instruments/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.message").value("Instrument not found with identifier: nope"));
    }

    @Test
    void updatePrice_refreshesAndReturnsInstrument() throws Exception {
        when(instrumentCatalog.get("ins-1")).thenReturn(etf);

        mockMvc.perform(put("/api/instruments/ins-1/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"price":455.10}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.id").value("ins-1"));

        ArgumentCaptor<BigDecimal> price = ArgumentCaptor.forClass(BigDecimal.class);
        verify(instrumentCatalog).refreshPrice(eq("ins-1"), price.capture());
        assertThat(price.getValue()).isEqualByComparingTo("455.10");
    }

    @Test
    void updatePrice_negative_returns400() throws Exception {
        mockMvc.perform(put("/api/instruments/ins-1/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"price":-1}
                        """))
                .andExpect(status().isBadRequest());

        verify(instrumentCatalog, never()).refreshPrice(any(), any());
    }

    @Test
    void updatePrice_unknownInstrument_returns404() throws Exception {
        doThrow(new ResourceNotFoundException("Instrument", "nope"))
                .when(instrumentCatalog)
                .refreshPrice(eq("nope"), any());

        mockMvc.perform(put("/api/instruments/nope/price")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                        {"price":10}
                        """))
                .andExpect(status().isNotFound());
    }

    @Test
    void delistInstrument_returns204() throws Exception {
        mockMvc.perform(delete("/api/instruments/ins-1")).andExpect(status().isNoContent());

        verify(instrumentCatalog).delist("ins-1");
    }

    @Test
    void delistInstrument_unknown_returns404() throws Exception {
        doThrow(new ResourceNotFoundException("Instrument", "nope"))
                .when(instrumentCatalog)
                .delist("nope");

        mockMvc.perform(delete("/api/instruments/nope")).andExpect(status().isNotFound());
    }
}
