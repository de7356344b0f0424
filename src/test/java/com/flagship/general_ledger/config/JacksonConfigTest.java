package com.flagship.general_ledger.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.general_ledger.money.CurrencyCode;
import com.flagship.general_ledger.money.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JacksonConfigTest {

    private final ObjectMapper mapper = new JacksonConfig().objectMapper();

    @Test
    @DisplayName("Money is written as a string amount with its currency")
    void testMoneySerialization() throws Exception {
        JsonNode node = mapper.readTree(mapper.writeValueAsString(Money.of("1250.5", CurrencyCode.USD)));

        assertEquals("1250.50", node.get("amount").asText());
        assertTrue(node.get("amount").isTextual());
        assertEquals("USD", node.get("currency").asText());
    }

    @Test
    @DisplayName("Dates are ISO strings and decimals are never in exponent form")
    void testDatesAndDecimals() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("asOf", LocalDate.of(2024, 1, 31));
        body.put("rate", new BigDecimal("1E+3"));

        String json = mapper.writeValueAsString(body);

        assertEquals("{\"asOf\":\"2024-01-31\",\"rate\":1000}", json);
    }
}
