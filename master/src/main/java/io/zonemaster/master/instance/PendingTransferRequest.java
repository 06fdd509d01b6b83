package io.zonemaster.master.instance;

import io.zonemaster.api.transport.PeerAddress;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A zone transfer waiting on an instance.
 *
 * @param requestId id chosen by the requesting worker, echoed in every reply
 * @param firstEntry first-entry ("mythran shift") flag, carried through untouched
 * @param requester peer to answer once the transfer is affirmed
 */
public record PendingTransferRequest(long requestId, boolean firstEntry, @Nonnull PeerAddress requester) {

    public PendingTransferRequest {
        Objects.requireNonNull(requester, "requester");
    }
}
