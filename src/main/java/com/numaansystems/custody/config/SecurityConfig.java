package com.numaansystems.custody.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.custody.ratelimit.RequestAdmission;
import com.numaansystems.custody.security.AccessGate;
import com.numaansystems.custody.security.InternalAccessFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.List;

/**
 * Security configuration for the custody service.
 * Configures a stateless filter chain and guards the internal endpoints
 * with the {@link InternalAccessFilter}.
 *
 * <p>There are no user logins: public endpoints are open, internal ones are
 * authorized by the shared API key and optional address allow-list.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    /**
     * Configures the security filter chain with CORS support and the internal access filter.
     *
     * @param http the HttpSecurity to configure
     * @param accessGate API key and address check
     * @param admission rate limiting for internal callers
     * @param objectMapper used to write rejection bodies
     * @param properties service configuration
     * @return the configured SecurityFilterChain
     * @throws Exception if an error occurs during configuration
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   AccessGate accessGate,
                                                   RequestAdmission admission,
                                                   ObjectMapper objectMapper,
                                                   CustodyProperties properties) throws Exception {
        http
            .cors(cors -> cors.configurationSource(corsConfigurationSource(properties)))
            .csrf(csrf -> csrf.disable())
            .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .httpBasic(basic -> basic.disable())
            .formLogin(form -> form.disable())
            .logout(logout -> logout.disable())
            .authorizeHttpRequests(authorize -> authorize
                .anyRequest().permitAll()
            )
            .addFilterBefore(new InternalAccessFilter(accessGate, admission, objectMapper),
                AuthorizationFilter.class);

        return http.build();
    }

    /**
     * Configures CORS for browser clients calling the public endpoints.
     * No origin is allowed unless listed in {@code custody.cors.allowed-origins}.
     *
     * @param properties service configuration
     * @return the configured CorsConfigurationSource
     */
    private CorsConfigurationSource corsConfigurationSource(CustodyProperties properties) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOrigins(properties.cors().allowedOrigins());
        configuration.setAllowedMethods(Arrays.asList("GET", "POST", "OPTIONS"));
        configuration.setAllowedHeaders(List.of("*"));
        configuration.setAllowCredentials(false);
        configuration.setMaxAge(3600L);
        configuration.setExposedHeaders(Arrays.asList("Retry-After", RequestIdFilter.REQUEST_ID_HEADER));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", configuration);
        return source;
    }
}
