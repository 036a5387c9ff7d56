module io.github.cyfko.partialresponse.core {
    requires java.logging;

    exports io.github.cyfko.partialresponse.core;
    exports io.github.cyfko.partialresponse.core.api;
    exports io.github.cyfko.partialresponse.core.cache;
    exports io.github.cyfko.partialresponse.core.config;
    exports io.github.cyfko.partialresponse.core.exception;
    exports io.github.cyfko.partialresponse.core.impl;
    exports io.github.cyfko.partialresponse.core.matching;
    exports io.github.cyfko.partialresponse.core.model;
    exports io.github.cyfko.partialresponse.core.projection;
}
