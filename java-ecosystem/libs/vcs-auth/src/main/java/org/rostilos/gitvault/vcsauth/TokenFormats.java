package org.rostilos.gitvault.vcsauth;

import org.rostilos.gitvault.core.exception.ValidationException;
import org.rostilos.gitvault.core.model.EPlatform;
import org.rostilos.gitvault.core.model.SecretValue;

import java.nio.CharBuffer;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Offline token format checks. Runs before any network call so typos are caught
 * without sending a malformed secret anywhere.
 */
public final class TokenFormats {

    private static final List<Pattern> GITHUB_PATTERNS = List.of(
            Pattern.compile("^gh[pousr]_[A-Za-z0-9]{36}$"),
            Pattern.compile("^github_pat_[A-Za-z0-9_]{82}$")
    );

    private static final List<Pattern> GITLAB_PATTERNS = List.of(
            Pattern.compile("^(glpat|gloas|gldt)-[A-Za-z0-9_\\-]{20,}$"),
            // OAuth access tokens
            Pattern.compile("^[a-f0-9]{64}$")
    );

    private static final List<Pattern> BITBUCKET_PATTERNS = List.of(
            Pattern.compile("^(ATBB|ATAT|ATCTT)[A-Za-z0-9_=\\-]{20,}$")
    );

    private static final List<Pattern> GENERIC_PATTERNS = List.of(
            Pattern.compile("^[\\x21-\\x7E]{8,}$")
    );

    private static final Pattern SCOPE_PATTERN = Pattern.compile("^[A-Za-z0-9_:.\\-]+$");
    private static final Pattern TWO_FACTOR_CODE_PATTERN = Pattern.compile("^[0-9]{6,8}$");

    private TokenFormats() {
        // Utility class
    }

    public static boolean isValidTokenFormat(EPlatform platform, SecretValue token) {
        if (token == null || token.isEmpty()) {
            return false;
        }
        // Matching needs a CharSequence; the char[] is wiped right after
        char[] chars = token.toCharArray();
        try {
            CharBuffer sequence = CharBuffer.wrap(chars);
            for (Pattern pattern : patternsFor(platform)) {
                if (pattern.matcher(sequence).matches()) {
                    return true;
                }
            }
            return false;
        } finally {
            Arrays.fill(chars, '\0');
        }
    }

    /**
     * @throws ValidationException when the token is empty or does not look like a token of the platform
     */
    public static void requireValidTokenFormat(EPlatform platform, SecretValue token) {
        if (token == null || token.isEmpty()) {
            throw new ValidationException("token", platform.name() + "_EMPTY_TOKEN", "Token cannot be empty");
        }
        if (!isValidTokenFormat(platform, token)) {
            throw new ValidationException("token",
                    platform.name() + "_INVALID_TOKEN_FORMAT",
                    "Invalid " + platform.getId() + " token format");
        }
    }

    /**
     * @throws ValidationException when a scope contains characters no platform uses
     */
    public static void requireValidScopes(List<String> scopes) {
        if (scopes == null) {
            return;
        }
        for (String scope : scopes) {
            if (scope == null || !SCOPE_PATTERN.matcher(scope).matches()) {
                throw new ValidationException("scopes", "INVALID_SCOPE", "Invalid scope: '" + scope + "'");
            }
        }
    }

    public static boolean isWellFormedTwoFactorCode(String code) {
        return code != null && TWO_FACTOR_CODE_PATTERN.matcher(code).matches();
    }

    /**
     * Scopes in {@code required} not covered by {@code granted}. A granted scope also
     * covers its {@code scope:sub} children, as GitHub's {@code repo} covers {@code repo:status}.
     */
    public static List<String> missingScopes(List<String> required, List<String> granted) {
        return required.stream()
                .filter(scope -> !granted.contains(scope))
                .filter(scope -> {
                    int colon = scope.indexOf(':');
                    return colon <= 0 || !granted.contains(scope.substring(0, colon));
                })
                .toList();
    }

    private static List<Pattern> patternsFor(EPlatform platform) {
        return switch (platform) {
            case GITHUB -> GITHUB_PATTERNS;
            case GITLAB -> GITLAB_PATTERNS;
            case BITBUCKET -> BITBUCKET_PATTERNS;
            case GENERIC -> GENERIC_PATTERNS;
        };
    }
}
