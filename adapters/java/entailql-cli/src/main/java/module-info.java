module io.github.cyfko.entailql.cli {
    requires io.github.cyfko.entailql.core;

    exports io.github.cyfko.entailql.cli;
}
