package com.itdesk.backend.config;

import com.itdesk.backend.domain.enums.Role;
import com.itdesk.backend.domain.enums.TicketPriority;
import com.itdesk.backend.domain.enums.TicketStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Autowired
    private ActivityInterceptor activityInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(activityInterceptor)
                .addPathPatterns("/api/**");
    }

    // Query params chegam em minúsculas (?status=in_progress), igual ao JSON
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, TicketStatus.class, TicketStatus::fromValue);
        registry.addConverter(String.class, TicketPriority.class, TicketPriority::fromValue);
        registry.addConverter(String.class, Role.class, Role::fromValue);
    }
}
