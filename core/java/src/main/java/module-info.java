module io.github.cyfko.logicql.core {
    requires java.logging;
    requires com.fasterxml.jackson.databind;

    exports io.github.cyfko.logicql.core;
    exports io.github.cyfko.logicql.core.api;
    exports io.github.cyfko.logicql.core.codec;
    exports io.github.cyfko.logicql.core.config;
    exports io.github.cyfko.logicql.core.exception;
    exports io.github.cyfko.logicql.core.impl;
    exports io.github.cyfko.logicql.core.model;
    exports io.github.cyfko.logicql.core.parsing;
    exports io.github.cyfko.logicql.core.table;
    exports io.github.cyfko.logicql.core.utils;
}
