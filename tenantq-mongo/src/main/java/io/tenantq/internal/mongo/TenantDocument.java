package io.tenantq.internal.mongo;

import io.tenantq.tenant.TenantRecord;
import io.tenantq.tenant.TenantStatus;
import io.tenantq.tenant.TenantTier;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Set;

@Document(collection = "tenants")
public class TenantDocument {

    @Id
    private String id;
    private String slug;
    private TenantTier tier;
    private TenantStatus status;
    private Set<String> featureFlags;

    public TenantDocument() {
    }

    public static TenantDocument from(TenantRecord r) {
        TenantDocument doc = new TenantDocument();
        doc.setId(r.tenantId());
        doc.setSlug(r.slug());
        doc.setTier(r.tier());
        doc.setStatus(r.status());
        doc.setFeatureFlags(r.featureFlags());
        return doc;
    }

    public TenantRecord toRecord() {
        return new TenantRecord(id, slug, tier, status, featureFlags);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public TenantTier getTier() {
        return tier;
    }

    public void setTier(TenantTier tier) {
        this.tier = tier;
    }

    public TenantStatus getStatus() {
        return status;
    }

    public void setStatus(TenantStatus status) {
        this.status = status;
    }

    public Set<String> getFeatureFlags() {
        return featureFlags;
    }

    public void setFeatureFlags(Set<String> featureFlags) {
        this.featureFlags = featureFlags;
    }
}
