package com.verifymyprovider.api.lookup;

import com.verifymyprovider.core.repository.ProviderRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@Transactional(readOnly = true)
public class JpaProviderLookup implements ProviderLookup {

    private final ProviderRepository providerRepository;

    public JpaProviderLookup(ProviderRepository providerRepository) {
        this.providerRepository = providerRepository;
    }

    @Override
    public boolean exists(String npi) {
        return npi != null && providerRepository.existsById(npi);
    }

    @Override
    public Optional<String> specialtyOf(String npi) {
        return providerRepository.findSpecialtyText(npi);
    }
}
