package com.example.smartroll.service;

import com.example.smartroll.dto.RouterPushRequest;
import com.example.smartroll.entities.DeviceAttachment;
import com.example.smartroll.model.DeviceIdentifier;
import com.example.smartroll.repository.DeviceAttachmentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Write side of the device attachment table, fed by router pushes.
 * The check-in flow only ever reads this table.
 */
@Service
@RequiredArgsConstructor
public class NetworkAttachmentService {

    private final Logger log = LoggerFactory.getLogger(NetworkAttachmentService.class);

    private final DeviceAttachmentRepository attachmentRepository;
    private final Clock clock;

    /**
     * Upsert one attachment per reported device. Entries with a malformed MAC or
     * without an address are skipped.
     *
     * @return number of attachments written
     */
    @Transactional
    public int recordAttachments(List<RouterPushRequest.ConnectedDevice> devices) {
        if (devices == null || devices.isEmpty()) return 0;
        Instant now = clock.instant();
        int saved = 0;
        for (RouterPushRequest.ConnectedDevice dev : devices) {
            if (dev == null) continue;
            if (!DeviceIdentifier.isValid(dev.getMac())) {
                log.warn("router_push: skipping entry with malformed mac '{}'", dev.getMac());
                continue;
            }
            if (dev.getIp() == null || dev.getIp().isBlank()) {
                log.warn("router_push: skipping mac {} without ip", dev.getMac());
                continue;
            }
            DeviceIdentifier device = DeviceIdentifier.parse(dev.getMac());
            DeviceAttachment attachment = attachmentRepository.findById(device.value())
                    .orElseGet(() -> DeviceAttachment.builder().deviceId(device.value()).build());
            attachment.setNetworkAddress(dev.getIp().trim());
            attachment.setObservedAt(now);
            attachmentRepository.save(attachment);
            saved++;
        }
        log.info("router_push: recorded {} of {} reported devices", saved, devices.size());
        return saved;
    }
}
