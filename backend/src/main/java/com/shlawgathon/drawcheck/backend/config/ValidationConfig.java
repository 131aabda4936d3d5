package com.shlawgathon.drawcheck.backend.config;

import com.shlawgathon.drawcheck.backend.annotation.AnnotatedDocumentStore;
import com.shlawgathon.drawcheck.backend.annotation.DocumentAnnotator;
import com.shlawgathon.drawcheck.backend.annotation.PdfDocumentAnnotator;
import com.shlawgathon.drawcheck.backend.extraction.DrawingExtractor;
import com.shlawgathon.drawcheck.backend.extraction.ExtractionSettings;
import com.shlawgathon.drawcheck.backend.orchestration.ValidationOrchestrator;
import com.shlawgathon.drawcheck.backend.standards.StandardsStore;
import com.shlawgathon.drawcheck.backend.validation.DrawingValidator;
import com.shlawgathon.drawcheck.backend.validation.ValidationDomain;
import com.shlawgathon.drawcheck.backend.validation.ValidatorRegistry;
import com.shlawgathon.drawcheck.backend.validation.checklist.EquipmentChecklistValidator;
import com.shlawgathon.drawcheck.backend.validation.gdt.GdtValidator;
import com.shlawgathon.drawcheck.backend.validation.material.MaterialValidator;
import com.shlawgathon.drawcheck.backend.validation.welding.WeldingValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Validator beans, the capability registry and the orchestrator.
 */
@Configuration
public class ValidationConfig {

    private static final Logger log = LoggerFactory.getLogger(ValidationConfig.class);

    @Value("${drawcheck.validation.enabled-domains:gdt,welding,material,equipmentChecklist}")
    private List<String> enabledDomains;

    @Value("${drawcheck.validation.worker-threads:4}")
    private int workerThreads;

    @Bean
    public GdtValidator gdtValidator() {
        return new GdtValidator();
    }

    @Bean
    public WeldingValidator weldingValidator() {
        return new WeldingValidator();
    }

    @Bean
    public MaterialValidator materialValidator() {
        return new MaterialValidator();
    }

    @Bean
    public EquipmentChecklistValidator equipmentChecklistValidator() {
        return new EquipmentChecklistValidator();
    }

    @Bean
    public ValidatorRegistry validatorRegistry(List<DrawingValidator> validators) {
        Set<ValidationDomain> enabled = EnumSet.noneOf(ValidationDomain.class);
        for (String key : enabledDomains) {
            ValidationDomain.fromKey(key).ifPresentOrElse(enabled::add,
                    () -> log.warn("[VALIDATION] Ignoring unknown domain '{}' in enabled-domains", key));
        }
        ValidatorRegistry registry = new ValidatorRegistry(validators, enabled);
        log.info("[VALIDATION] Validators available: {}", registry.availableDomains());
        return registry;
    }

    @Bean
    @ConditionalOnProperty(name = "drawcheck.annotation.enabled", havingValue = "true", matchIfMissing = true)
    public DocumentAnnotator documentAnnotator() {
        return new PdfDocumentAnnotator();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService validatorExecutor() {
        return Executors.newFixedThreadPool(workerThreads);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ValidationOrchestrator validationOrchestrator(DrawingExtractor extractor, StandardsStore standards,
            ValidatorRegistry registry, ObjectProvider<DocumentAnnotator> annotator,
            ObjectProvider<AnnotatedDocumentStore> documentStore,
            @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor,
            @Qualifier("validatorExecutor") ExecutorService validatorExecutor,
            ExtractionSettings settings, Clock clock) {
        return new ValidationOrchestrator(extractor, standards, registry, annotator.getIfAvailable(),
                documentStore.getIfAvailable(), pipelineExecutor, validatorExecutor, settings.documentTimeout(),
                clock);
    }
}
