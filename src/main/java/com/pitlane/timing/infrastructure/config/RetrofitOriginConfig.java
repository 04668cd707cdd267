package com.pitlane.timing.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pitlane.timing.infrastructure.adapter.origin.ErgastTimingApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

@Configuration
public class RetrofitOriginConfig {

    @Bean
    public ErgastTimingApi ergastTimingApi(@Value("${pitlane.origin.base-url:https://api.jolpi.ca/}") String baseUrl) {
        return createApi(baseUrl);
    }

    public static ErgastTimingApi createApi(String baseUrl) {
        ObjectMapper jsonMapper = new ObjectMapper();
        jsonMapper.registerModule(new JavaTimeModule());
        jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(baseUrl.endsWith("/") ? baseUrl : baseUrl + "/")
                .addConverterFactory(JacksonConverterFactory.create(jsonMapper))
                .build();

        return retrofit.create(ErgastTimingApi.class);
    }
}
