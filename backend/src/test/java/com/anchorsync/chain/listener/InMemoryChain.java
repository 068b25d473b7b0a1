package com.anchorsync.chain.listener;

import com.anchorsync.chain.ChainProvider;
import com.anchorsync.chain.NetworkInfo;
import com.anchorsync.chain.RpcException;
import com.anchorsync.domain.BlockHeader;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Test chain: block i has hash "h{i}" on the canonical fork; {@link #reorgFrom(long)} replaces the blocks from
 * the given height with a fork whose hashes are "f{i}".
 */
class InMemoryChain implements ChainProvider {

    private final List<BlockHeader> blocks = new ArrayList<>();
    private final Set<Long> failing = new HashSet<>();

    InMemoryChain(long headNumber) {
        for (long i = 0; i <= headNumber; i++) {
            blocks.add(new BlockHeader(i, "h" + i, i == 0 ? "0x0" : "h" + (i - 1)));
        }
    }

    synchronized void mine(int count) {
        for (int i = 0; i < count; i++) {
            BlockHeader tip = blocks.get(blocks.size() - 1);
            blocks.add(new BlockHeader(tip.number() + 1, "h" + (tip.number() + 1), tip.hash()));
        }
    }

    synchronized void reorgFrom(long height) {
        String parent = blocks.get((int) height - 1).hash();
        for (long i = height; i < blocks.size(); i++) {
            BlockHeader forked = new BlockHeader(i, "f" + i, parent);
            blocks.set((int) i, forked);
            parent = forked.hash();
        }
    }

    synchronized void failOn(long number) {
        failing.add(number);
    }

    synchronized void heal(long number) {
        failing.remove(number);
    }

    @Override
    public synchronized BlockHeader getBlock(long offsetFromHead) {
        return getBlockByNumber(Math.max(0, getBlockNumber() + offsetFromHead));
    }

    @Override
    public synchronized BlockHeader getBlockByNumber(long number) {
        if (failing.contains(number)) {
            throw new RpcException("block " + number + " unavailable");
        }
        return blocks.get((int) number);
    }

    @Override
    public synchronized BlockHeader getBlockByHash(String hash) {
        return blocks.stream()
                .filter(b -> b.hash().equals(hash))
                .findFirst()
                .orElseThrow(() -> new RpcException("unknown block " + hash));
    }

    @Override
    public synchronized long getBlockNumber() {
        return blocks.size() - 1;
    }

    @Override
    public NetworkInfo getNetwork() {
        return new NetworkInfo(1337);
    }
}
