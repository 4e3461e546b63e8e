package com.jay.formulaengine.layer6_execution.broker;

import com.jay.formulaengine.layer6_execution.UnknownBrokerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps broker-type tags to their {@link BrokerClient}. Built once from every BrokerClient bean.
 */
@Slf4j
@Component
public class BrokerRegistry {

    private final Map<String, BrokerClient> brokers;

    public BrokerRegistry(List<BrokerClient> clients) {
        Map<String, BrokerClient> byTag = new TreeMap<>();
        for (BrokerClient client : clients) {
            String tag = client.brokerType().toLowerCase(Locale.ROOT);
            BrokerClient previous = byTag.putIfAbsent(tag, client);
            if (previous != null) {
                throw new IllegalStateException("Duplicate broker type '" + tag + "': "
                    + previous.getClass().getSimpleName() + " and " + client.getClass().getSimpleName());
            }
        }
        this.brokers = Map.copyOf(byTag);
        log.info("BrokerRegistry initialized with {}", byTag.keySet());
    }

    public BrokerClient resolve(String brokerType) {
        if (brokerType == null) throw new UnknownBrokerException(null);
        BrokerClient client = brokers.get(brokerType.toLowerCase(Locale.ROOT));
        if (client == null) throw new UnknownBrokerException(brokerType);
        return client;
    }

    public boolean supports(String brokerType) {
        return brokerType != null && brokers.containsKey(brokerType.toLowerCase(Locale.ROOT));
    }

    public Set<String> brokerTypes() {
        return brokers.keySet();
    }
}
