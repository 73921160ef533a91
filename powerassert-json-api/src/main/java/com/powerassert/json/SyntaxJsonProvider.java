package com.powerassert.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for exchanging syntax trees as JSON, for instance with a codegen
 * harness running outside the JVM. Implementations are discovered via Java's
 * ServiceLoader mechanism.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * SyntaxJsonProvider provider = SyntaxJsonProvider.getProvider();
 * Expr expression = provider.getDeserializer().deserializeExpr(json);
 * Expr rewritten = new CaptureRewriter(expression, offset).rewrite();
 * String out = provider.getSerializer().serialize(rewritten);
 * }</pre>
 */
public interface SyntaxJsonProvider {

    SyntaxJsonSerializer getSerializer();

    SyntaxJsonDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     */
    String getName();

    /**
     * Gets the first available SyntaxJsonProvider via ServiceLoader.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static SyntaxJsonProvider getProvider() {
        ServiceLoader<SyntaxJsonProvider> loader = ServiceLoader.load(SyntaxJsonProvider.class);
        Iterator<SyntaxJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No SyntaxJsonProvider found on the classpath. " +
            "Add powerassert-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Gets a SyntaxJsonProvider by name via ServiceLoader.
     *
     * @param name the provider name, compared case-insensitively
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static SyntaxJsonProvider getProvider(String name) {
        ServiceLoader<SyntaxJsonProvider> loader = ServiceLoader.load(SyntaxJsonProvider.class);
        for (SyntaxJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No SyntaxJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }

    static boolean isProviderAvailable() {
        ServiceLoader<SyntaxJsonProvider> loader = ServiceLoader.load(SyntaxJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
