package mirage.cli;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import picocli.CommandLine.Option;

import mirage.ai.env.CharacterProfile;
import mirage.ai.env.Trait;
import mirage.cli.json.ProfileDocument;

/**
 * Where the participating characters come from: JSON profile files first,
 * then bare keys with neutral profiles. Inline {@code -t} assignments
 * override personality scalars, addressed to a participant as
 * {@code N:TRAIT=VALUE} (participant 1 when {@code N:} is omitted).
 */
public class ProfileOptions {

    @Option(
        names = {"-p", "--profile"},
        description = "Character profile JSON file. Repeat for each participant.",
        paramLabel = "FILE"
    )
    private List<File> profileFiles = new ArrayList<>();

    @Option(
        names = {"-k", "--key"},
        description = "Identity key of a character with a neutral profile. Repeat for each participant.",
        paramLabel = "KEY"
    )
    private List<String> keys = new ArrayList<>();

    @Option(
        names = {"-t", "--trait"},
        description = "Personality override as [N:]TRAIT=VALUE, TRAIT one of O,C,E,A,N (e.g. -t A=0.9 -t 2:N=0.8).",
        paramLabel = "[N:]T=V"
    )
    private List<String> traitAssignments = new ArrayList<>();

    public List<File> getProfileFiles() {
        return profileFiles;
    }

    public List<String> getKeys() {
        return keys;
    }

    public List<String> getTraitAssignments() {
        return traitAssignments;
    }

    /**
     * Build exactly {@code count} profiles.
     *
     * @throws ProfileException if the sources do not yield exactly {@code count} profiles or are invalid
     */
    public List<CharacterProfile> resolve(int count) {
        List<CharacterProfile.Builder> builders = new ArrayList<>();
        for (File f : profileFiles) {
            builders.add(ProfileDocument.read(f.toPath()).toProfile().toBuilder());
        }
        for (String k : keys) {
            builders.add(CharacterProfile.builder(k));
        }
        if (builders.size() != count) {
            throw new ProfileException("Expected " + count + " character(s) from --profile/--key, got "
                    + builders.size());
        }
        for (String assignment : traitAssignments) {
            applyAssignment(builders, assignment);
        }
        List<CharacterProfile> profiles = new ArrayList<>(count);
        try {
            for (CharacterProfile.Builder b : builders) {
                profiles.add(b.build());
            }
        } catch (IllegalArgumentException e) {
            throw new ProfileException(e.getMessage(), e);
        }
        return profiles;
    }

    private static void applyAssignment(List<CharacterProfile.Builder> builders, String assignment) {
        int participant = 0;
        String rest = assignment;
        int colon = assignment.indexOf(':');
        if (colon > 0) {
            try {
                participant = Integer.parseInt(assignment.substring(0, colon)) - 1;
            } catch (NumberFormatException e) {
                throw new ProfileException("Invalid trait assignment '" + assignment + "' (expected [N:]TRAIT=VALUE)", e);
            }
            rest = assignment.substring(colon + 1);
        }
        int eq = rest.indexOf('=');
        if (eq <= 0 || eq == rest.length() - 1) {
            throw new ProfileException("Invalid trait assignment '" + assignment + "' (expected [N:]TRAIT=VALUE)");
        }
        if (participant < 0 || participant >= builders.size()) {
            throw new ProfileException("Trait assignment '" + assignment + "' names participant "
                    + (participant + 1) + " of " + builders.size());
        }
        try {
            Trait trait = Trait.parse(rest.substring(0, eq).trim());
            double value = Double.parseDouble(rest.substring(eq + 1).trim());
            builders.get(participant).trait(trait, value);
        } catch (IllegalArgumentException e) {
            throw new ProfileException("Invalid trait assignment '" + assignment + "': " + e.getMessage(), e);
        }
    }
}
