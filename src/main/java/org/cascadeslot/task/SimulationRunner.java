package org.cascadeslot.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.cascadeslot.config.SlotProperties;
import org.cascadeslot.dto.SimulationReport;
import org.cascadeslot.service.SlotEngine;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Lance une simulation au démarrage quand {@code slot.simulation.enabled=true}
 * et journalise le rapport en JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "slot.simulation", name = "enabled", havingValue = "true")
public class SimulationRunner implements CommandLineRunner {

    private final SlotEngine engine;
    private final SlotProperties props;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) throws JsonProcessingException {
        SlotProperties.Simulation sim = props.getSimulation();
        log.info("Simulation : {} spins à {}", sim.getSpins(), sim.getBet());
        SimulationReport report = engine.simulate(sim.getBet(), sim.getSpins());
        log.info("Rapport de simulation : {}", objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
    }
}
