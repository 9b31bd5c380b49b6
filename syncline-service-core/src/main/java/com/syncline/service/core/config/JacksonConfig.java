package com.syncline.service.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Sync payloads keep explicit nulls: a cleared field must reach the client as null, not be dropped. */
@Configuration
public class JacksonConfig {

    @Bean
    public static BeanPostProcessor objectMapperIsoDatesCustomizer() {
        return new BeanPostProcessor() {
            @Override
            public Object postProcessAfterInitialization(Object bean, String beanName) {
                if (bean instanceof ObjectMapper om) {
                    om.registerModule(new JavaTimeModule());
                    om.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
                }
                return bean;
            }
        };
    }
}
