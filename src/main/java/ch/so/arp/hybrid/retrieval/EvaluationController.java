package ch.so.arp.hybrid.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EvaluationController {

    private static final Logger LOGGER = LoggerFactory.getLogger(EvaluationController.class);

    private final RetrievalEvaluator evaluator;

    public EvaluationController(RetrievalEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @PostMapping(path = "/api/evaluation", produces = MediaType.APPLICATION_JSON_VALUE)
    public EvaluationReport evaluate() {
        LOGGER.info("Retrieval evaluation requested");
        return evaluator.evaluate();
    }
}
