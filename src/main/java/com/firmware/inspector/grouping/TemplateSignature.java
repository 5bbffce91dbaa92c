package com.firmware.inspector.grouping;

import lombok.NonNull;
import lombok.Value;

/**
 * Template family and specialization recovered from a symbol display name.
 * {@code specializationKey} is null when the argument list is empty.
 */
@Value
public class TemplateSignature {

    @NonNull
    String groupName;

    String specializationKey;
}
