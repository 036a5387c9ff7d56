module io.github.cyfko.partialresponse.jackson {
    requires io.github.cyfko.partialresponse.core;
    requires com.fasterxml.jackson.core;
    requires com.fasterxml.jackson.databind;

    exports io.github.cyfko.partialresponse.jackson;
}
