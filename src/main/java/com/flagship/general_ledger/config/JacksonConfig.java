package com.flagship.general_ledger.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.flagship.general_ledger.money.Money;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.io.IOException;

/**
 * Jackson configuration for the REST layer.
 *
 * - Java 8 date/time support, ISO-8601 strings rather than timestamps
 * - {@link Money} written as {@code {"amount": "12.50", "currency": "USD"}};
 *   the amount is a string so no client parses it as a binary double
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(moneyModule());

        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);

        return mapper;
    }

    static SimpleModule moneyModule() {
        SimpleModule module = new SimpleModule("ledger-money");
        module.addSerializer(Money.class, new MoneySerializer());
        return module;
    }

    static class MoneySerializer extends JsonSerializer<Money> {
        @Override
        public void serialize(Money value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("amount", value.getAmount().toPlainString());
            gen.writeStringField("currency", value.getCurrency().name());
            gen.writeEndObject();
        }
    }
}
