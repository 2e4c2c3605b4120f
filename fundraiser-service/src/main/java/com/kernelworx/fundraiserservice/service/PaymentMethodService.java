package com.kernelworx.fundraiserservice.service;

import com.kernelworx.fundraiserservice.dto.PaymentMethodResponse;
import com.kernelworx.fundraiserservice.security.CallerIdentity;

import java.util.List;

public interface PaymentMethodService {

    List<PaymentMethodResponse> myPaymentMethods(CallerIdentity caller);

    /**
     * Methods of the profile owner, as seen by anyone who can read the profile.
     * Empty when the caller cannot.
     */
    List<PaymentMethodResponse> paymentMethodsForProfile(String profileId, CallerIdentity caller);

    PaymentMethodResponse createPaymentMethod(String name, CallerIdentity caller);

    PaymentMethodResponse updatePaymentMethod(String currentName, String newName, CallerIdentity caller);

    void deletePaymentMethod(String name, CallerIdentity caller);
}
