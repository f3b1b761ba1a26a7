package com.github.collomatique.problem;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Identity of a script: its name and the SHA-256 of its content. Two scripts with the same
 * reference compile to the same checked AST.
 */
public record ScriptRef(String name, String hash) {

    public static ScriptRef of(Script script) {
        return new ScriptRef(script.name(), sha256(script.content()));
    }

    private static String sha256(String content) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    @Override
    public String toString() {
        return name + "@" + hash.substring(0, 12);
    }
}
