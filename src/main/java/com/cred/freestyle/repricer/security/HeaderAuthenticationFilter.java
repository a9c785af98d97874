package com.cred.freestyle.repricer.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.List;

/**
 * Authenticates admin API callers from headers set by the internal gateway.
 *
 * - X-Operator-Id: operator identifier (required for authenticated requests)
 * - X-Operator-Role: role, defaults to OPERATOR; ADMIN is needed for the admin endpoints
 *
 * @author Repricer Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    static final String OPERATOR_ID_HEADER = "X-Operator-Id";
    static final String OPERATOR_ROLE_HEADER = "X-Operator-Role";
    private static final String DEFAULT_ROLE = "OPERATOR";
    private static final String ROLE_PREFIX = "ROLE_";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String operatorId = request.getHeader(OPERATOR_ID_HEADER);

        if (operatorId != null && !operatorId.isBlank()) {
            String role = request.getHeader(OPERATOR_ROLE_HEADER);
            if (role == null || role.isBlank()) {
                role = DEFAULT_ROLE;
            }
            if (!role.startsWith(ROLE_PREFIX)) {
                role = ROLE_PREFIX + role;
            }

            List<SimpleGrantedAuthority> authorities = Collections.singletonList(new SimpleGrantedAuthority(role));
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(operatorId, null, authorities);
            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated operator: {} with role: {}", operatorId, role);
        } else {
            logger.debug("No {} header found, request will be unauthenticated", OPERATOR_ID_HEADER);
        }

        filterChain.doFilter(request, response);
    }
}
