package com.settingsproxy.core.store;

import com.settingsproxy.core.model.SettingOwner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Versioned, in-memory backing store for settings.
 *
 * <p>
 * Every saved version is kept. A record is <em>current</em> while its
 * {@link StoredSetting#getVersionEnd() versionEnd} is unset; saving a
 * {@link StoredSetting#copy() copy} closes the version it was copied from and
 * deleting closes the current one. Owners are matched by identity.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe, like the proxies built on top of it.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemorySettingStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemorySettingStore.class);

    private final Clock clock;
    private final List<StoredSetting> records = new ArrayList<>();
    private long nextId = 1;

    public InMemorySettingStore() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock source of version timestamps
     */
    public InMemorySettingStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
    }

    /**
     * Create a new, unsaved record. Usable as a
     * {@link com.settingsproxy.core.model.SettingFactory}.
     *
     * @param owner owner of the record
     * @param key   setting key
     * @return unsaved record with a fresh identity
     */
    public StoredSetting newSetting(SettingOwner owner, String key) {
        Objects.requireNonNull(owner, "Owner must not be null");
        Objects.requireNonNull(key, "Setting key must not be null");
        return new StoredSetting(this, UUID.randomUUID(), owner, key, null);
    }

    /**
     * @param owner the owner
     * @return the owner's current records, in save order
     */
    public List<StoredSetting> current(SettingOwner owner) {
        return records.stream()
                .filter(r -> r.getOwner() == owner && r.isCurrent())
                .toList();
    }

    /**
     * @param owner the owner
     * @param key   setting key
     * @return every saved version of the key, oldest first
     */
    public List<StoredSetting> history(SettingOwner owner, String key) {
        return records.stream()
                .filter(r -> r.getOwner() == owner && r.getKey().equals(key))
                .sorted(Comparator.comparingLong(StoredSetting::getId))
                .toList();
    }

    /**
     * @return number of saved versions across all owners
     */
    public int size() {
        return records.size();
    }

    // ---------------------------------------------------------------
    // Called by StoredSetting
    // ---------------------------------------------------------------

    void persist(StoredSetting setting) {
        if (setting.getId() != null) {
            LOG.trace("Updated version {} of '{}' in place", setting.getId(), setting.getKey());
            return;
        }
        Instant now = clock.instant();
        for (StoredSetting record : records) {
            if (record.isCurrent() && record.getIdentity().equals(setting.getIdentity())) {
                record.close(now);
                LOG.debug("Closed version {} of '{}'", record.getId(), record.getKey());
            }
        }
        setting.open(nextId++, now);
        records.add(setting);
    }

    void close(StoredSetting setting) {
        setting.close(clock.instant());
        LOG.debug("Deleted '{}' (version {})", setting.getKey(), setting.getId());
    }
}
