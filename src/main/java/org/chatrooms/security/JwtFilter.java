package org.chatrooms.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.chatrooms.dto.Identity;
import org.chatrooms.exception.UnauthorizedException;
import org.chatrooms.service.TokenVerifier;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

@Component // JWT filter applied to every HTTP request
@RequiredArgsConstructor
public class JwtFilter extends OncePerRequestFilter {

    private final TokenVerifier tokenVerifier;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader("Authorization");
        String token = null;
        if (header != null && header.startsWith("Bearer ")) {
            token = header.substring(7);
        } else if (request.getParameter("token") != null) {
            token = request.getParameter("token"); // support ?token=...
        }

        if (token != null) {
            try {
                Identity identity = tokenVerifier.verify(token);
                UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                        identity, null, List.of(new SimpleGrantedAuthority("ROLE_" + identity.role())));
                SecurityContextHolder.getContext().setAuthentication(auth);
            } catch (UnauthorizedException e) {
                // left anonymous: the filter chain answers 401 on protected routes
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }
}
