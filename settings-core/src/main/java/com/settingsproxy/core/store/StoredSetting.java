package com.settingsproxy.core.store;

import com.settingsproxy.core.model.Setting;
import com.settingsproxy.core.model.SettingOwner;

import java.time.Instant;
import java.util.UUID;

/**
 * One version of a setting held by an {@link InMemorySettingStore}.
 *
 * <p>
 * All versions of the same logical setting share an {@link #getIdentity()
 * identity}. A version that has been closed, by a newer version or by
 * {@link #delete()}, can no longer be saved, copied or deleted.
 * </p>
 *
 * @since 1.0.0
 */
public class StoredSetting implements Setting {

    private final InMemorySettingStore store;
    private final UUID identity;
    private final SettingOwner owner;
    private final String key;
    private String value;

    private Long id;
    private Instant versionStart;
    private Instant versionEnd;

    StoredSetting(InMemorySettingStore store, UUID identity, SettingOwner owner,
                  String key, String value) {
        this.store = store;
        this.identity = identity;
        this.owner = owner;
        this.key = key;
        this.value = value;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public void setValue(String value) {
        this.value = value;
    }

    @Override
    public StoredSetting copy() {
        requireOpen("copy");
        return new StoredSetting(store, identity, owner, key, value);
    }

    @Override
    public void save() {
        requireOpen("save");
        store.persist(this);
    }

    @Override
    public void delete() {
        if (id == null) {
            throw new IllegalStateException("Cannot delete unsaved setting '" + key + "'");
        }
        requireOpen("delete");
        store.close(this);
    }

    public UUID getIdentity() {
        return identity;
    }

    public SettingOwner getOwner() {
        return owner;
    }

    /**
     * @return store-assigned id, or {@code null} before the first save
     */
    public Long getId() {
        return id;
    }

    public Instant getVersionStart() {
        return versionStart;
    }

    /**
     * @return when this version stopped being current, or {@code null} while
     *         it is current
     */
    public Instant getVersionEnd() {
        return versionEnd;
    }

    public boolean isCurrent() {
        return id != null && versionEnd == null;
    }

    void open(long id, Instant start) {
        this.id = id;
        this.versionStart = start;
    }

    void close(Instant end) {
        this.versionEnd = end;
    }

    private void requireOpen(String operation) {
        if (versionEnd != null) {
            throw new IllegalStateException("Cannot " + operation + " closed version "
                    + id + " of setting '" + key + "'");
        }
    }

    @Override
    public String toString() {
        return "StoredSetting{" +
                "id=" + id +
                ", key='" + key + '\'' +
                ", value='" + value + '\'' +
                ", versionStart=" + versionStart +
                ", versionEnd=" + versionEnd +
                '}';
    }
}
