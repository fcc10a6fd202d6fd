package org.rostilos.buildcrow.core.model.repo;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ERepoHost} by its host tag ({@code github.com}) rather than the enum name.
 */
@Converter
public class ERepoHostConverter implements AttributeConverter<ERepoHost, String> {

    @Override
    public String convertToDatabaseColumn(ERepoHost host) {
        return host != null ? host.getId() : null;
    }

    @Override
    public ERepoHost convertToEntityAttribute(String hostId) {
        return hostId != null ? ERepoHost.fromId(hostId) : null;
    }
}
