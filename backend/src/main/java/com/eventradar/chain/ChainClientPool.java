package com.eventradar.chain;

import com.eventradar.metrics.SchedulerMetrics;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared chain clients keyed by chain ID. Populated once by {@link #connectAll}, read by every lookup,
 * and torn down only by {@link #closeAll}. Workers borrow clients and never close them.
 */
@Slf4j
public class ChainClientPool {

    private final ChainClientFactory factory;
    private final SchedulerMetrics metrics;
    private final Map<String, ChainClient> clients = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ChainClientPool(ChainClientFactory factory, SchedulerMetrics metrics) {
        this.factory = factory;
        this.metrics = metrics;
    }

    /**
     * Dials every configured chain once and checks liveness by fetching its network chain ID.
     * Chains that fail are logged and skipped.
     *
     * @return number of chains connected
     */
    public int connectAll(Map<String, List<String>> rpcUrlsByChain) {
        Map<String, ChainClient> connected = new TreeMap<>();
        rpcUrlsByChain.forEach((chainId, urls) -> connect(chainId, urls).ifPresent(c -> connected.put(chainId, c)));
        lock.writeLock().lock();
        try {
            clients.putAll(connected);
            return clients.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Optional<ChainClient> connect(String chainId, List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            log.warn("Skipping chain without RPC URLs: chainId={}", chainId);
            metrics.chainConnection(chainId, false);
            return Optional.empty();
        }
        ChainClient client = null;
        try {
            client = factory.connect(chainId, urls);
            BigInteger networkId = client.networkChainId();
            log.info("Connected to chain: chainId={}, networkId={}, endpoints={}", chainId, networkId, urls.size());
            metrics.chainConnection(chainId, true);
            return Optional.of(client);
        } catch (RuntimeException e) {
            log.warn("Failed to connect to chain, skipping: chainId={}, error={}", chainId, e.getMessage());
            metrics.chainConnection(chainId, false);
            if (client != null) {
                client.close();
            }
            return Optional.empty();
        }
    }

    public Optional<ChainClient> get(String chainId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(clients.get(chainId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> chainIds() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(clients.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return clients.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Closes and removes every client.
     *
     * @return number of chains disconnected
     */
    public int closeAll() {
        List<ChainClient> toClose;
        lock.writeLock().lock();
        try {
            toClose = new ArrayList<>(clients.values());
            clients.clear();
        } finally {
            lock.writeLock().unlock();
        }
        for (ChainClient client : toClose) {
            try {
                client.close();
            } catch (RuntimeException e) {
                log.warn("Error closing chain client: chainId={}, error={}", client.chainId(), e.getMessage());
            }
        }
        return toClose.size();
    }
}
