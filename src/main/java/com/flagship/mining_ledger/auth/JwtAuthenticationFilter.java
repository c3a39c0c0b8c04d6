package com.flagship.mining_ledger.auth;

import com.flagship.mining_ledger.observability.CorrelationContext;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Authenticates Bearer tokens. The principal is the account id ({@link UUID}).
 *
 * A token that fails verification leaves the request unauthenticated and
 * records why in {@link #AUTH_ERROR_ATTRIBUTE}, which
 * {@link JsonAuthenticationEntryPoint} reports if the route needs a session.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTRIBUTE = "mining_ledger.auth.error";
    static final String TOKEN_EXPIRED = "Token expired";
    static final String INVALID_TOKEN = "Invalid token";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        final String authHeader = request.getHeader("Authorization");
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        UUID accountId;
        try {
            accountId = jwtService.extractAccountId(authHeader.substring(BEARER_PREFIX.length()));
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired token");
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, TOKEN_EXPIRED);
            filterChain.doFilter(request, response);
            return;
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            request.setAttribute(AUTH_ERROR_ATTRIBUTE, INVALID_TOKEN);
            filterChain.doFilter(request, response);
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                accountId, null, List.of(new SimpleGrantedAuthority("ROLE_USER")));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId.toString());
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }
}
