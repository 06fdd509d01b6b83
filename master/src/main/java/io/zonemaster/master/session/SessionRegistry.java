package io.zonemaster.master.session;

import io.zonemaster.api.transport.ControlTransport;
import io.zonemaster.master.protocol.MasterPackets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one active session key per account.
 *
 * <p>Setting a new key for an account that already holds one evicts the old
 * session and broadcasts {@code NewSessionAlert} with the old key, so every
 * worker can drop the connection that used it.</p>
 */
public class SessionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

    private final ControlTransport transport;

    private final Map<String, Long> keysByAccount = new ConcurrentHashMap<>();
    private final Map<Long, String> accountsByKey = new ConcurrentHashMap<>();

    public SessionRegistry(@Nonnull ControlTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    /**
     * Record the session key of an account.
     *
     * @param accountName account name
     * @param sessionKey new session key
     */
    public void setKey(@Nonnull String accountName, long sessionKey) {
        Objects.requireNonNull(accountName, "accountName");

        Long previousKey = keysByAccount.get(accountName);
        if (previousKey != null) {
            if (previousKey == sessionKey) {
                return;
            }
            accountsByKey.remove(previousKey);
            transport.broadcast(MasterPackets.newSessionAlert(previousKey, accountName));
            LOGGER.info("Evicted session {} of account {}", previousKey, accountName);
        }

        String previousOwner = accountsByKey.put(sessionKey, accountName);
        if (previousOwner != null && !previousOwner.equals(accountName)) {
            keysByAccount.remove(previousOwner, sessionKey);
            LOGGER.warn("Session key {} moved from account {} to {}", sessionKey, previousOwner, accountName);
        }
        keysByAccount.put(accountName, sessionKey);
        LOGGER.debug("Session key set for account {}", accountName);
    }

    /**
     * Look up the session key of an account.
     *
     * @param accountName account name
     * @return the key, or null if the account has no session
     */
    @Nullable
    public Long lookupByName(@Nonnull String accountName) {
        return keysByAccount.get(Objects.requireNonNull(accountName, "accountName"));
    }

    /**
     * Look up the account holding a session key.
     *
     * @param sessionKey session key
     * @return the account name, or null if the key is unknown
     */
    @Nullable
    public String lookupByKey(long sessionKey) {
        return accountsByKey.get(sessionKey);
    }

    public int size() {
        return keysByAccount.size();
    }
}
