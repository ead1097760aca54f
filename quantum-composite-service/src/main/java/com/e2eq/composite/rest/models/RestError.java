package com.e2eq.composite.rest.models;

import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

/**
 * Error envelope returned by the composite exception mappers.
 */
@Data
@EqualsAndHashCode
@SuperBuilder
@NoArgsConstructor
@RegisterForReflection
public class RestError {
   protected int status;
   protected String statusMessage;
   protected String reasonMessage;
   protected String debugMessage;
}
