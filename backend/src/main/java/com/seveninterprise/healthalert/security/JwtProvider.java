package com.seveninterprise.healthalert.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.Date;
import java.util.function.Function;

/**
 * Validação dos tokens emitidos pelo serviço de autenticação externo
 *
 * O subject é o userId do diretório e a claim "role" o papel do usuário.
 */
@Component
public class JwtProvider {

    static final String ROLE_CLAIM = "role";

    @Value("${jwt.secret.key}")
    private String secretKeyString;

    @Value("${jwt.expiration.hours:10}")
    private long expirationHours;

    private SecretKey SECRET_KEY;

    @PostConstruct
    public void init() {
        byte[] keyBytes = Decoders.BASE64.decode(secretKeyString);
        this.SECRET_KEY = Keys.hmacShaKeyFor(keyBytes);
    }

    public String extractUsername(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    public String extractRole(String token) {
        return extractClaim(token, claims -> claims.get(ROLE_CLAIM, String.class));
    }

    public Date extractExpiration(String token) {
        return extractClaim(token, Claims::getExpiration);
    }

    public <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
        final Claims claims = extractAllClaims(token);
        return claimsResolver.apply(claims);
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parserBuilder().setSigningKey(SECRET_KEY).build().parseClaimsJws(token).getBody();
    }

    private Boolean isTokenExpired(String token) {
        Date expiration = extractExpiration(token);
        return expiration != null && expiration.before(new Date());
    }

    /**
     * Emite um token de serviço (integrações de sistema e ambiente de desenvolvimento)
     */
    public String generateToken(String userId, String role) {
        return Jwts.builder()
                .setSubject(userId)
                .claim(ROLE_CLAIM, role)
                .setIssuedAt(new Date(System.currentTimeMillis()))
                .setExpiration(new Date(System.currentTimeMillis() + 1000L * 60 * 60 * expirationHours))
                .signWith(SECRET_KEY)
                .compact();
    }

    public Boolean isTokenValid(String token) {
        final String username = extractUsername(token);
        return username != null && !username.isBlank() && !isTokenExpired(token);
    }
}
