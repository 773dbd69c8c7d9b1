package com.craftnotify.engine.config;

import com.craftnotify.common.channel.ChannelSet;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores a {@link ChannelSet} as its integer bit mask.
 */
@Converter(autoApply = true)
public class ChannelSetConverter implements AttributeConverter<ChannelSet, Integer> {

    @Override
    public Integer convertToDatabaseColumn(ChannelSet attribute) {
        return attribute == null ? null : attribute.mask();
    }

    @Override
    public ChannelSet convertToEntityAttribute(Integer dbData) {
        return dbData == null ? ChannelSet.none() : ChannelSet.fromMask(dbData);
    }
}
