package com.formcalc.formula;

import com.formcalc.util.EngineConfig;
import com.formcalc.util.EntityDefinitionLoader;
import com.formcalc.util.LoggingUtil;

import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * Command line entry point: evaluates every calculated field and output mapping of one
 * entity definition file.
 *
 * <pre>FormulaRunner &lt;entity.json&gt; [config.json]</pre>
 * Exit code 0 when everything evaluated, 1 when a field or output failed, 2 on bad usage or input.
 */
public class FormulaRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_FIELD_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: FormulaRunner <entity.json> [config.json]");
            return EXIT_USAGE;
        }

        EngineConfig config;
        EntityDefinition entity;
        try {
            config = args.length == 2 ? new EngineConfig(args[1]) : EngineConfig.loadDefault();
            LoggingUtil.initialize(config);
            entity = EntityDefinitionLoader.loadFromFile(new File(args[0]));
        } catch (IOException | IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return EXIT_USAGE;
        }

        FormulaService service = new FormulaService(config);
        LoggingUtil.info("=== Evaluating entity '" + entity.getId() + "' ===");
        Outcome<EntityEvaluation> evaluation = service.evaluateEntity(entity);
        if (evaluation.isFailure()) {
            LoggingUtil.error(evaluation.getError().toString());
            return EXIT_FIELD_FAILURE;
        }

        EntityEvaluation result = evaluation.getValue();
        result.getResults().forEach((field, outcome) -> LoggingUtil.info(String.format("%-20s : %s", field,
                outcome.isSuccess() ? outcome.getValue().render() : outcome.getError())));

        Outcome<Map<String, OutputValue>> outputs = service.evaluateEntityOutputs(entity, result.getSnapshot());
        if (outputs.isSuccess()) {
            LoggingUtil.info("=== Outputs ===");
            outputs.getValue().forEach((field, output) -> LoggingUtil.info(String.format("%-20s : %s (%s)",
                    field, output.getValue().render(), output.getTarget())));
        } else {
            LoggingUtil.error(outputs.getError().toString());
        }

        return result.isSuccess() && outputs.isSuccess() ? EXIT_OK : EXIT_FIELD_FAILURE;
    }
}
