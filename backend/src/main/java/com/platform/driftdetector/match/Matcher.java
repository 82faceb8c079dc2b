package com.platform.driftdetector.match;

import com.platform.driftdetector.error.AmbiguousAddressException;
import com.platform.driftdetector.resource.Origin;
import com.platform.driftdetector.resource.ResourceModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Pairs declared with observed resources by address in linear time.
 */
@Slf4j
public class Matcher {
    
    /**
     * @throws AmbiguousAddressException if an address occurs twice within one origin set
     */
    public MatchResult match(Collection<ResourceModel> declared, Collection<ResourceModel> observed) {
        Map<String, ResourceModel> declaredByAddress = index(declared, Origin.DECLARED);
        Map<String, ResourceModel> observedByAddress = index(observed, Origin.OBSERVED);
        
        List<MatchedPair> pairs = new ArrayList<>();
        List<ResourceModel> orphans = new ArrayList<>();
        List<ResourceModel> unmanaged = new ArrayList<>();
        
        for (ResourceModel model : declaredByAddress.values()) {
            ResourceModel counterpart = observedByAddress.get(model.address());
            if (counterpart != null) {
                pairs.add(MatchedPair.matched(model, counterpart));
            } else {
                orphans.add(model);
            }
        }
        for (ResourceModel model : observedByAddress.values()) {
            if (!declaredByAddress.containsKey(model.address())) {
                unmanaged.add(model);
            }
        }
        
        pairs.sort(Comparator.comparing(MatchedPair::address));
        orphans.sort(Comparator.comparing(ResourceModel::address));
        unmanaged.sort(Comparator.comparing(ResourceModel::address));
        
        log.debug("Matched {} pairs, {} orphans, {} unmanaged", pairs.size(), orphans.size(), unmanaged.size());
        return new MatchResult(pairs, orphans, unmanaged);
    }
    
    private static Map<String, ResourceModel> index(Collection<ResourceModel> models, Origin origin) {
        Map<String, ResourceModel> byAddress = new HashMap<>(Math.max(16, models.size() * 2));
        TreeSet<String> duplicates = new TreeSet<>();
        for (ResourceModel model : models) {
            if (model.origin() != origin) {
                throw new IllegalArgumentException(String.format(
                    "Resource %s has origin %s in the %s set", model.address(), model.origin(), origin));
            }
            if (byAddress.putIfAbsent(model.address(), model) != null) {
                duplicates.add(model.address());
            }
        }
        if (!duplicates.isEmpty()) {
            throw new AmbiguousAddressException(origin, List.copyOf(duplicates));
        }
        return byAddress;
    }
}
