package shipguard.core.model.audit;

/**
 * What an audited operation acted upon.
 *
 * @param resourceType the kind of resource, e.g. {@code shipment}
 * @param resourceId the resource identifier
 */
public record ResourceRef(String resourceType, String resourceId) {}
