package com.tracepile.store;

import com.tracepile.store.cache.MetadataCacheManager;
import com.tracepile.store.config.PileConfig;
import com.tracepile.store.pile.TimeBucket;
import com.tracepile.store.pile.TracePile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;

/**
 * Command line tool printing the layout of a pile.
 *
 * <pre>
 * java -Dtracepile.cache.dir=/var/cache/tp com.tracepile.store.PileInspector data/2001
 * </pre>
 */
public class PileInspector {
    private static final Logger LOG = LoggerFactory.getLogger(PileInspector.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: PileInspector <file-or-directory>...");
            System.exit(2);
        }

        PileConfig config = PileConfig.load();
        LOG.info("Using metadata cache {}", config.getCacheDir());

        List<String> paths = Arrays.asList(args);
        TracePile pile = Piles.makePile(paths, null, config, new MetadataCacheManager());

        LOG.info("\n{}", pile);
        for (TimeBucket bucket : pile.getBuckets().values()) {
            LOG.info("{}: {} file(s), {} station(s)", bucket.getKey(), bucket.getFiles().size(),
                bucket.getStations().size());
        }
        LOG.info("Sample intervals: {}", pile.getDeltats());
    }
}
