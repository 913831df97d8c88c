package com.wealthdesk.repository.memory;

import com.wealthdesk.domain.model.RiskProfile;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/** Current risk profile per client. Saving replaces the previous profile. */
@Repository
public class RiskProfileMemoryRepository {

    private final Map<String, RiskProfile> profiles = new ConcurrentHashMap<>();

    public void save(RiskProfile profile) {
        profiles.put(profile.getClientId(), profile);
    }

    public Optional<RiskProfile> findByClientId(String clientId) {
        return Optional.ofNullable(profiles.get(clientId));
    }
}
