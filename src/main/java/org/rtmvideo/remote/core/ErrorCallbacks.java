package org.rtmvideo.remote.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public interface ErrorCallbacks {

    void onError(ErrorCondition error);

    class Logging implements ErrorCallbacks {
        private static final Logger log = LoggerFactory.getLogger(Logging.class);

        private final String name;

        public Logging(String name) {
            this.name = name;
        }

        public Logging() {
            this("rtm");
        }

        @Override
        public void onError(ErrorCondition error) {
            log.error("{}: {}", name, error);
        }
    }
}
