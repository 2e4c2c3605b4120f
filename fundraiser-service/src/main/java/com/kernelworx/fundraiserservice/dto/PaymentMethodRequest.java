package com.kernelworx.fundraiserservice.dto;

import lombok.Data;

/**
 * Name of a custom payment method. Validation is done by the service so that
 * trimming happens before the length and reserved-name checks.
 */
@Data
public class PaymentMethodRequest {

    private String name;
}
