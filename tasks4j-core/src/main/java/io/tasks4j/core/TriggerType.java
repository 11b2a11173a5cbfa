package io.tasks4j.core;

public enum TriggerType {
    ONCE {
        @Override
        public boolean isRecurring() {
            return false;
        }
    },
    INTERVAL {
        @Override
        public boolean isRecurring() {
            return true;
        }
    },
    CRON {
        @Override
        public boolean isRecurring() {
            return true;
        }
    };

    public abstract boolean isRecurring();
}
