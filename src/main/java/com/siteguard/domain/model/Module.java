package com.siteguard.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.UUID;

/**
 * Canonical identity of an extension module, shared by every site that installs it.
 *
 * <p><strong>Invariants:</strong>
 * <ul>
 *   <li>Machine name is unique and never changes</li>
 *   <li>Descriptive fields are first-writer-wins: once populated they are never overwritten</li>
 *   <li>Never hard-deleted while a site references it</li>
 * </ul>
 */
@Entity
@Table(
    name = "modules",
    uniqueConstraints = @UniqueConstraint(name = "uq_module_machine_name", columnNames = "machine_name")
)
@Getter
@DynamicUpdate
@NoArgsConstructor(access = AccessLevel.PROTECTED) // JPA requirement
public class Module {

    public static final int MAX_MACHINE_NAME_LENGTH = 255;

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "machine_name", nullable = false, updatable = false, length = MAX_MACHINE_NAME_LENGTH)
    private String machineName;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", length = 20)
    private ModuleCategory category;

    @Column(name = "project_link", length = 500)
    private String link;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    private Module(UUID id, String machineName, String displayName, ModuleCategory category,
                   String link, Instant createdAt) {
        this.id = id;
        this.machineName = machineName;
        this.displayName = displayName;
        this.category = category;
        this.link = link;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    /**
     * Create a module on first sighting.
     *
     * @param machineName unique machine name, already validated
     * @param metadata descriptive metadata from the first submitter
     * @param now creation timestamp
     * @return new, unsaved module
     */
    public static Module create(String machineName, ModuleMetadata metadata, Instant now) {
        return new Module(
            UUID.randomUUID(),
            machineName,
            blankToNull(metadata.displayName()),
            metadata.category(),
            blankToNull(metadata.link()),
            now
        );
    }

    /**
     * Fill descriptive fields that are still empty. Populated fields are left alone so
     * inconsistent reports from different sites cannot make them oscillate.
     *
     * @return true if anything changed
     */
    public boolean enrich(ModuleMetadata metadata, Instant now) {
        boolean changed = false;
        if (displayName == null && blankToNull(metadata.displayName()) != null) {
            displayName = metadata.displayName().trim();
            changed = true;
        }
        if (category == null && metadata.category() != null) {
            category = metadata.category();
            changed = true;
        }
        if (link == null && blankToNull(metadata.link()) != null) {
            link = metadata.link().trim();
            changed = true;
        }
        if (changed) {
            updatedAt = now;
        }
        return changed;
    }

    /**
     * Whether {@link #enrich} would change anything.
     */
    public boolean canBeEnrichedBy(ModuleMetadata metadata) {
        return (displayName == null && blankToNull(metadata.displayName()) != null)
            || (category == null && metadata.category() != null)
            || (link == null && blankToNull(metadata.link()) != null);
    }

    /**
     * Display name, falling back to the machine name when none was ever reported.
     */
    public String getLabel() {
        return displayName != null ? displayName : machineName;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
