package com.williamcallahan.actdb.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.actdb.amender.ModificationExtractor;
import com.williamcallahan.actdb.amender.apply.ArticleTitleAmendmentApplier;
import com.williamcallahan.actdb.amender.apply.BlockAmendmentApplier;
import com.williamcallahan.actdb.amender.apply.ModificationApplier;
import com.williamcallahan.actdb.amender.apply.RepealApplier;
import com.williamcallahan.actdb.amender.apply.SaeTextAmendmentApplier;
import com.williamcallahan.actdb.amender.apply.StructuralBlockAmendmentApplier;
import com.williamcallahan.actdb.amender.apply.StructuralTitleAmendmentApplier;
import com.williamcallahan.actdb.config.PersistenceConfig;
import com.williamcallahan.actdb.database.ActDatabase;
import com.williamcallahan.actdb.domain.identifier.ActIdentifier;
import com.williamcallahan.actdb.domain.structure.Act;
import com.williamcallahan.actdb.fixups.FixupStore;
import com.williamcallahan.actdb.parser.RetainingSemanticInfoProvider;
import com.williamcallahan.actdb.parser.SemanticInfoProvider;
import com.williamcallahan.actdb.persistence.ActCache;
import com.williamcallahan.actdb.persistence.ContentHasher;
import com.williamcallahan.actdb.persistence.Persistence;
import java.nio.file.Path;
import java.time.LocalDate;

/**
 * Wires the storage and amendment services over a temporary directory without a Spring context.
 */
final class EngineFixture {

    final ObjectMapper objectMapper = PersistenceConfig.createObjectMapper();
    final FixupStore fixupStore;
    final ActDatabase database;
    final SemanticInfoProvider semanticInfoProvider = new RetainingSemanticInfoProvider();
    final ModificationExtractor extractor;
    final ModificationApplier applier;
    final AmendmentApplicationDriver driver;
    final RecalculationService recalculationService;
    final ActIngestionService ingestionService;
    final ActQueryService queryService;

    EngineFixture(Path root) {
        fixupStore = new FixupStore(root.resolve("fixups"), objectMapper);
        Persistence persistence = new Persistence(root.resolve("db"), objectMapper, new ContentHasher(),
                new ActCache(256));
        database = new ActDatabase(persistence, fixupStore);
        extractor = new ModificationExtractor(fixupStore);
        applier = new ModificationApplier(new ArticleTitleAmendmentApplier(),
                new SaeTextAmendmentApplier(semanticInfoProvider), new StructuralTitleAmendmentApplier(),
                new RepealApplier(), new BlockAmendmentApplier(semanticInfoProvider),
                new StructuralBlockAmendmentApplier(semanticInfoProvider));
        driver = driverOver(database);
        recalculationService = new RecalculationService(database, driver);
        ingestionService = new ActIngestionService(database, objectMapper);
        queryService = new ActQueryService(database, fixupStore);
    }

    /** Builds a driver with this engine's collaborators over another database view. */
    AmendmentApplicationDriver driverOver(ActDatabase actDatabase) {
        return new AmendmentApplicationDriver(actDatabase, extractor, applier, semanticInfoProvider, fixupStore);
    }

    /** Stores the acts into the state of {@code date}, as if all of them were published then. */
    void seedState(LocalDate date, Act... acts) {
        var state = database.actSet(date);
        for (Act act : acts) {
            state = database.storeAct(state, act);
        }
        database.saveActSet(date, state);
    }

    Act actAt(ActIdentifier id, LocalDate date) {
        return database.loadAct(database.actSet(date).entry(id).orElseThrow());
    }
}
