package com.leanfinance.services.onboardings.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Actuator endpoints live on management.server.port. Requests for them that
 * reach the application port get a 404, except the health probe used by the
 * container platform.
 */
@Component
@Order(1)
@Slf4j
public class ActuatorSecurityFilter extends OncePerRequestFilter {

    private static final String ACTUATOR_PREFIX = "/actuator";
    private static final String HEALTH_PATH = "/actuator/health";

    @Value("${server.port:8080}")
    private int applicationPort;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();

        if (isBlocked(path) && request.getServerPort() == applicationPort) {
            log.warn("Blocked actuator request on application port: path={}, ip={}",
                    path, request.getRemoteAddr());
            response.setStatus(HttpStatus.NOT_FOUND.value());
            response.getWriter().write("{\"error\":\"Not Found\"}");
            return;
        }

        filterChain.doFilter(request, response);
    }

    boolean isBlocked(String path) {
        if (path == null || !path.startsWith(ACTUATOR_PREFIX)) return false;
        return !path.equals(HEALTH_PATH) && !path.startsWith(HEALTH_PATH + "/");
    }
}
