package com.copytraderadar.api.validation;

import com.copytraderadar.common.Addresses;
import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Delegates to {@link Addresses#isEvmAddress} so the registry and the API agree on the format.
 */
public class EvmAddressValidator implements ConstraintValidator<EvmAddress, String> {

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || Addresses.isEvmAddress(value);
    }
}
