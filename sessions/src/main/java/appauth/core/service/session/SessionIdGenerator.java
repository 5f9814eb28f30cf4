package appauth.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Random;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Session ID source.
 *
 * <p>IDs are 256 random bits in unpadded URL-safe Base64, so they never contain the
 * {@code :} separator or glob characters of the storage key layout and stay
 * interchangeable with IDs written by earlier deployments.
 */
@ApplicationScoped
public class SessionIdGenerator {

    static final int ID_BYTES = 32;
    static final int ID_LENGTH = 43;

    private static final Base64.Encoder URL_SAFE = Base64.getUrlEncoder().withoutPadding();

    private final Random random;

    public SessionIdGenerator() {
        this(new SecureRandom());
    }

    SessionIdGenerator(Random random) {
        this.random = random;
    }

    /**
     * @return a fresh {@value #ID_LENGTH}-character session ID
     */
    public String generate() {
        byte[] bytes = new byte[ID_BYTES];
        random.nextBytes(bytes);
        return URL_SAFE.encodeToString(bytes);
    }
}
