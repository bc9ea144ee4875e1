package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetProfile;
import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.domain.EpisodicRecord;
import com.openforge.docrouter.domain.ExperienceSource;
import com.openforge.docrouter.domain.SenderMapping;
import com.openforge.docrouter.knowledge.procedural.MatchingParameters;
import com.openforge.docrouter.memory.ExperienceProperties;
import com.openforge.docrouter.memory.SimilarExperience;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AssetIdentifierTest {

    static final MatchingParameters PARAMS = new MatchingParameters(
            0.95, 0.5, 0.95, 0.85, 0.75, 0.65, 0.8, 4, 0.10, 0.30, 5.0, 0.05, 0.10, 0.5,
            List.of("deal", "fund", "loan", "credit", "property", "portfolio", "investment", "asset", "capital"));

    static final ExperienceProperties EXPERIENCE = new ExperienceProperties(0.5, 10, 500, 0.4, 0.1, 10000, 180, 500);

    private final AssetIdentifier identifier = new AssetIdentifier(EXPERIENCE);

    static AssetProfile asset(String id, String dealName, AssetType type, String... identifiers) {
        return AssetProfile.builder()
                .assetId(id)
                .dealName(dealName)
                .assetType(type)
                .identifiers(new ArrayList<>(List.of(identifiers)))
                .build();
    }

    private List<AssetCandidate> identify(IdentificationContext context, List<AssetProfile> assets) {
        return identifier.identify(context, assets, Map.of(), PARAMS, List.of());
    }

    @Test
    void loanDocsForI3FromUnmappedSender() {
        List<AssetProfile> assets = List.of(
                asset("I3", "I3 Verticals", AssetType.PRIVATE_CREDIT, "i3", "i3 verticals", "verticals"),
                asset("HARBOR-POINT", "Harbor Point Plaza", AssetType.COMMERCIAL_REAL_ESTATE, "harbor point", "hpp"));
        IdentificationContext context = new IdentificationContext("unknown@lender.test", "i3 loan docs",
                "attached find the loan documents for the i3 deal", "RLV_TRM_i3_TD.pdf");

        List<AssetCandidate> candidates = identify(context, assets);

        assertEquals(1, candidates.size());
        AssetCandidate best = candidates.get(0);
        assertEquals("I3", best.assetId());
        assertEquals(AssetType.PRIVATE_CREDIT, best.assetType());
        assertTrue(best.confidence() > 0.6);
        assertEquals(0.95, best.confidence(), 1e-9);
    }

    @Test
    void strongerIdentifierTierRanksFirst() {
        List<AssetProfile> assets = List.of(
                asset("BRAVO", "Bravo Fund", AssetType.PRIVATE_EQUITY, "bravo"),
                asset("ALPHA", "Alpha Ridge", AssetType.INFRASTRUCTURE, "alpha ridge"));
        IdentificationContext context = new IdentificationContext(null, "alpha ridge and bravoo update", null, "update.pdf");

        List<AssetCandidate> candidates = identify(context, assets);

        assertEquals(List.of("ALPHA", "BRAVO"), candidates.stream().map(AssetCandidate::assetId).toList());
        assertEquals(0.95, candidates.get(0).confidence(), 1e-9);
        assertEquals(0.75, candidates.get(1).confidence(), 1e-9);
    }

    @Test
    void emptyCatalogYieldsNoCandidates() {
        IdentificationContext context = new IdentificationContext("a@b.test", "i3 loan docs", "", "x.pdf");

        assertTrue(identify(context, List.of()).isEmpty());
        assertTrue(identifier.identify(context, null, Map.of(), PARAMS, List.of()).isEmpty());
    }

    @Test
    void trustedSenderSeedsItsAssets() {
        List<AssetProfile> assets = List.of(asset("NORTHWIND", "Northwind Holdings", AssetType.PRIVATE_EQUITY, "northwind"));
        IdentificationContext context = new IdentificationContext("Ops <OPS@northwind.test>", "monthly pack", "", "pack.pdf");

        SenderMapping trusted = SenderMapping.builder().senderAddress("ops@northwind.test")
                .assetIds(new ArrayList<>(List.of("NORTHWIND"))).trustScore(0.9).build();
        List<AssetCandidate> seeded = identifier.identify(context, assets,
                Map.of("ops@northwind.test", trusted), PARAMS, List.of());

        assertEquals(1, seeded.size());
        assertEquals(0.95, seeded.get(0).confidence(), 1e-9);

        SenderMapping untrusted = SenderMapping.builder().senderAddress("ops@northwind.test")
                .assetIds(new ArrayList<>(List.of("NORTHWIND"))).trustScore(0.3).build();
        assertTrue(identifier.identify(context, assets,
                Map.of("ops@northwind.test", untrusted), PARAMS, List.of()).isEmpty());
    }

    @Test
    void genericIdentifierIsPenalised() {
        List<AssetProfile> assets = List.of(asset("GAMMA", "Gamma Partners", AssetType.PRIVATE_EQUITY, "gamma", "fund"));
        IdentificationContext context = new IdentificationContext(null, "fund update", "", "notes.pdf");

        List<AssetCandidate> candidates = identify(context, assets);

        assertEquals(1, candidates.size());
        assertEquals(0.85, candidates.get(0).confidence(), 1e-9);
    }

    @Test
    void identifierOnlyInLongFilenameIsDiluted() {
        List<AssetProfile> assets = List.of(asset("ALPHA", "Alpha Ridge", AssetType.INFRASTRUCTURE, "alpha"));
        IdentificationContext context = new IdentificationContext(null, "weekly files", "",
                "very_long_filename_with_alpha_inside_stuff.pdf");

        List<AssetCandidate> candidates = identify(context, assets);

        assertEquals(1, candidates.size());
        assertEquals(0.90, candidates.get(0).confidence(), 1e-9);
    }

    @Test
    void humanCorrectionsBoostTheCorrectedAsset() {
        List<AssetProfile> assets = List.of(asset("GRIDLINE", "Gridline Renewables", AssetType.INFRASTRUCTURE,
                "gridline", "gridline solar"));
        IdentificationContext context = new IdentificationContext(null, "gridlines output", "", "output.xlsx");
        EpisodicRecord correction = EpisodicRecord.builder()
                .filename("output_q1.xlsx")
                .assetId("GRIDLINE")
                .predictedCategory("operations_reports")
                .source(ExperienceSource.HUMAN_CORRECTION)
                .confidence(1.0)
                .build();

        double plain = identify(context, assets).get(0).confidence();
        double boosted = identifier.identify(context, assets, Map.of(), PARAMS,
                List.of(new SimilarExperience(correction, 0.5))).get(0).confidence();

        assertEquals(0.75, plain, 1e-9);
        assertEquals(0.95, boosted, 1e-9);
    }
}
