package com.example.mediacatalog_backend.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.util.List;

/**
 * Stateless API security. With {@code catalog.auth.require-auth=true} every endpoint except
 * health and service info needs HTTP Basic credentials; otherwise everything is open.
 */
@Configuration
@EnableWebSecurity
public class WebSecurityConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(WebSecurityConfig.class);

    @Bean
    SecurityFilterChain api(HttpSecurity http, AuthProperties auth) throws Exception {
        http
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(AbstractHttpConfigurer::disable)
                .cors(Customizer.withDefaults());

        if (auth.isRequireAuth()) {
            LOGGER.info("API authentication enabled (basic) user={}", auth.getUsername());
            http.authorizeHttpRequests(a -> a
                            .requestMatchers("/actuator/health/**", "/service", "/v3/api-docs/**", "/swagger-ui/**").permitAll()
                            .anyRequest().authenticated())
                    .httpBasic(Customizer.withDefaults());
        } else {
            http.authorizeHttpRequests(a -> a.anyRequest().permitAll());
        }
        return http.build();
    }

    @Bean
    PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }

    @Bean
    UserDetailsService apiUsers(AuthProperties auth, PasswordEncoder encoder) {
        if (!auth.isRequireAuth()) {
            return new InMemoryUserDetailsManager();
        }
        if (auth.getPassword() == null || auth.getPassword().isBlank()) {
            throw new IllegalStateException("catalog.auth.password must be set when catalog.auth.require-auth=true");
        }
        return new InMemoryUserDetailsManager(User.withUsername(auth.getUsername())
                .password(encoder.encode(auth.getPassword()))
                .roles("API")
                .build());
    }

    @Bean
    CorsConfigurationSource corsConfigurationSource() {
        var cfg = new CorsConfiguration();
        cfg.setAllowedOriginPatterns(List.of("*"));
        cfg.setAllowedMethods(List.of("GET", "HEAD", "POST", "PUT", "DELETE", "OPTIONS"));
        cfg.setAllowedHeaders(List.of("*"));
        cfg.setExposedHeaders(List.of("Content-Length", "Location", "Link"));
        cfg.setAllowCredentials(false);
        var src = new UrlBasedCorsConfigurationSource();
        src.registerCorsConfiguration("/**", cfg);
        return src;
    }
}
