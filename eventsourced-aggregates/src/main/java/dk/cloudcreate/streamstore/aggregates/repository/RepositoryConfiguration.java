package dk.cloudcreate.streamstore.aggregates.repository;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Paging configuration for {@link StreamStoreRepository}
 */
public final class RepositoryConfiguration {
    public static final int DEFAULT_READ_PAGE_SIZE        = 500;
    public static final int DEFAULT_MAX_APPEND_BATCH_SIZE = 500;

    /**
     * The maximum number of events read per round trip when loading an aggregate
     */
    public final int readPageSize;
    /**
     * The maximum number of events appended per round trip when saving an aggregate.
     * Saves with more pending events are split into several appends
     */
    public final int maxAppendBatchSize;

    private RepositoryConfiguration(int readPageSize, int maxAppendBatchSize) {
        checkArgument(readPageSize > 0, "readPageSize must be > 0, was %s", readPageSize);
        checkArgument(maxAppendBatchSize > 0, "maxAppendBatchSize must be > 0, was %s", maxAppendBatchSize);
        this.readPageSize = readPageSize;
        this.maxAppendBatchSize = maxAppendBatchSize;
    }

    public static RepositoryConfiguration defaultConfiguration() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RepositoryConfiguration{" +
                "readPageSize=" + readPageSize +
                ", maxAppendBatchSize=" + maxAppendBatchSize +
                '}';
    }

    public static final class Builder {
        private int readPageSize       = DEFAULT_READ_PAGE_SIZE;
        private int maxAppendBatchSize = DEFAULT_MAX_APPEND_BATCH_SIZE;

        private Builder() {
        }

        public Builder readPageSize(int readPageSize) {
            this.readPageSize = readPageSize;
            return this;
        }

        public Builder maxAppendBatchSize(int maxAppendBatchSize) {
            this.maxAppendBatchSize = maxAppendBatchSize;
            return this;
        }

        public RepositoryConfiguration build() {
            return new RepositoryConfiguration(readPageSize, maxAppendBatchSize);
        }
    }
}
