module io.github.cyfko.entailql.core {
    requires java.logging;

    exports io.github.cyfko.entailql.core;
    exports io.github.cyfko.entailql.core.api;
    exports io.github.cyfko.entailql.core.ast;
    exports io.github.cyfko.entailql.core.cache;
    exports io.github.cyfko.entailql.core.config;
    exports io.github.cyfko.entailql.core.entailment;
    exports io.github.cyfko.entailql.core.exception;
    exports io.github.cyfko.entailql.core.impl;
    exports io.github.cyfko.entailql.core.parsing;
}
