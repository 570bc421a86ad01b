package org.chatrooms.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import org.chatrooms.dto.Identity;
import org.chatrooms.exception.UnauthorizedException;
import org.chatrooms.service.TokenVerifier;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JwtTokenVerifier implements TokenVerifier {

    private final JwtUtil jwtUtil;

    @Override
    public Identity verify(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("Missing bearer token");
        }
        Claims claims;
        try {
            claims = jwtUtil.parse(token);
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid or expired token");
        }

        String userId = claims.getSubject();
        if (userId == null || userId.isBlank()) {
            throw new UnauthorizedException("Token has no subject");
        }
        String username = claims.get(JwtUtil.USERNAME_CLAIM, String.class);
        String role = claims.get(JwtUtil.ROLE_CLAIM, String.class);
        return new Identity(userId,
                (username != null && !username.isBlank()) ? username : userId,
                (role != null && !role.isBlank()) ? role : Identity.DEFAULT_ROLE);
    }
}
