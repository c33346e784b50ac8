package com.example.smartroll.presence;

import com.example.smartroll.entities.DeviceAttachment;
import com.example.smartroll.exception.CheckInUnavailableException;
import com.example.smartroll.model.DeviceIdentifier;
import com.example.smartroll.repository.DeviceAttachmentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Resolves presence from the device attachment table fed by the classroom routers.
 * Entries older than {@code smartroll.presence.max-attachment-age} are treated as unknown.
 */
@Component
@ConditionalOnProperty(name = "smartroll.presence.source", havingValue = "attachment-table", matchIfMissing = true)
public class AttachmentTableResolver implements NetworkPresenceResolver {

    private final Logger log = LoggerFactory.getLogger(AttachmentTableResolver.class);

    private final DeviceAttachmentRepository attachmentRepository;
    private final Clock clock;
    private final Duration maxAge;

    public AttachmentTableResolver(DeviceAttachmentRepository attachmentRepository,
                                   Clock clock,
                                   @Value("${smartroll.presence.max-attachment-age:PT2H}") Duration maxAge) {
        this.attachmentRepository = attachmentRepository;
        this.clock = clock;
        this.maxAge = maxAge;
    }

    @Override
    public Optional<String> resolve(DeviceIdentifier device) {
        Optional<DeviceAttachment> found;
        try {
            found = attachmentRepository.findById(device.value());
        } catch (DataAccessException | TransactionException ex) {
            log.warn("Attachment lookup failed for device={}: {}", device, ex.getMessage());
            throw new CheckInUnavailableException(CheckInUnavailableException.PRESENCE_RESOLVER,
                    "device attachment table unavailable", ex);
        }
        if (found.isEmpty()) {
            return Optional.empty();
        }
        DeviceAttachment attachment = found.get();
        Instant oldestAccepted = clock.instant().minus(maxAge);
        if (attachment.getObservedAt() == null || attachment.getObservedAt().isBefore(oldestAccepted)) {
            log.debug("Ignoring stale attachment for device={} observedAt={}", device, attachment.getObservedAt());
            return Optional.empty();
        }
        return Optional.of(attachment.getNetworkAddress());
    }
}
