package de.caluga.topology.driver.bson;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * creates {@link MongoId}s. The process unique part and the counter are held here instead of in static
 * state, so that a copied process (fork, checkpoint restore) can call {@link #resetForFork()} and will
 * never hand out ids its parent might also create.
 */
public class MongoIdGenerator {
    private static final Logger log = LoggerFactory.getLogger(MongoIdGenerator.class);
    private static volatile MongoIdGenerator defaultGenerator = new MongoIdGenerator();

    private final SecureRandom random = new SecureRandom();
    private final AtomicInteger counter;
    private volatile byte[] processUnique;

    public MongoIdGenerator() {
        processUnique = createProcessUnique();
        counter = new AtomicInteger(random.nextInt());
    }

    public static MongoIdGenerator getDefault() {
        return defaultGenerator;
    }

    public static void setDefault(MongoIdGenerator generator) {
        if (generator == null) {
            throw new IllegalArgumentException("generator must not be null");
        }

        defaultGenerator = generator;
    }

    public MongoId next() {
        return new MongoId(nextBytes(System.currentTimeMillis()));
    }

    byte[] nextBytes(long timeMillis) {
        int ts = (int) (timeMillis / 1000);
        int cnt = counter.getAndIncrement() & 0x00ffffff;
        byte[] unique = processUnique;
        byte[] b = new byte[12];
        b[0] = (byte) (ts >> 24);
        b[1] = (byte) (ts >> 16);
        b[2] = (byte) (ts >> 8);
        b[3] = (byte) ts;
        System.arraycopy(unique, 0, b, 4, 5);
        b[9] = (byte) (cnt >> 16);
        b[10] = (byte) (cnt >> 8);
        b[11] = (byte) cnt;
        return b;
    }

    /**
     * new process unique value and counter start
     */
    public synchronized void resetForFork() {
        processUnique = createProcessUnique();
        counter.set(random.nextInt());
        log.debug("id generator reset");
    }

    byte[] getProcessUnique() {
        return processUnique.clone();
    }

    private byte[] createProcessUnique() {
        byte[] b = new byte[5];
        random.nextBytes(b);
        return b;
    }
}
