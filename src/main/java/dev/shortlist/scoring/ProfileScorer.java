package dev.shortlist.scoring;

import dev.shortlist.model.CandidateProfile;
import dev.shortlist.model.CriterionScore;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.NormalizedSkill;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Overall fit of experience, skills and education.
 */
@Component
public class ProfileScorer implements CriterionScorer {

    private static final PiecewiseCurve REQUIRED_CURVE = PiecewiseCurve.topAt(1.0, 40)
            .band(0.9, 36)
            .band(0.75, 30)
            .band(0.6, 22)
            .band(0.5, 15)
            .build(40);

    private static final PiecewiseCurve OPTIONAL_CURVE = PiecewiseCurve.topAt(0.8, 10)
            .band(0.6, 7)
            .band(0.4, 4)
            .build(10);

    private static final double EDUCATION_POINTS = 20;
    private static final double NO_REQUIRED_SKILLS_CAP = 50;

    @Override
    public CriterionScore score(CandidateProfile profile, JobRequirement requirement) {
        if (requirement == null) {
            return scoreStandalone(profile);
        }

        double experience = experiencePoints(profile.yearsExperience(), requirement.experienceMin());
        double skills;
        String skillSummary;
        if (requirement.hasRequiredSkills()) {
            int matchedRequired = countMatched(requirement.requiredSkills(), profile.skills());
            double ratio = (double) matchedRequired / requirement.requiredSkills().size();
            skills = REQUIRED_CURVE.apply(ratio);
            skillSummary = String.format(Locale.ROOT, "required skills %d/%d",
                    matchedRequired, requirement.requiredSkills().size());
            if (!requirement.optionalSkills().isEmpty()) {
                int matchedOptional = countMatched(requirement.optionalSkills(), profile.skills());
                skills += OPTIONAL_CURVE.apply((double) matchedOptional / requirement.optionalSkills().size());
                skillSummary += String.format(Locale.ROOT, ", optional %d/%d",
                        matchedOptional, requirement.optionalSkills().size());
            }
        } else {
            skills = Math.min(NO_REQUIRED_SKILLS_CAP, 2.0 * profile.skills().size());
            skillSummary = profile.skills().size() + " skills";
        }
        double education = profile.education().isEmpty() ? 0 : EDUCATION_POINTS;
        double total = Math.min(100.0, experience + skills + education);

        return CriterionScore.of(total, String.format(Locale.ROOT,
                "Experience: %.1f years (minimum %d) | Skills: %s | Education: %d entries | Score: %.1f/100",
                profile.yearsExperience(), requirement.experienceMin(), skillSummary,
                profile.education().size(), total));
    }

    private CriterionScore scoreStandalone(CandidateProfile profile) {
        double total = 10.0 * Math.min(3, profile.yearsExperience())
                + 2.0 * Math.min(20, profile.skills().size())
                + 10.0 * Math.min(3, profile.education().size());
        return CriterionScore.of(total, String.format(Locale.ROOT,
                "Experience: %.1f years | Skills: %d | Education: %d entries | Score: %.1f/100",
                profile.yearsExperience(), profile.skills().size(), profile.education().size(), total));
    }

    private static double experiencePoints(double years, int minimum) {
        if (years >= minimum) {
            return 30;
        }
        if (years >= minimum * 0.7) {
            return 20;
        }
        if (years >= minimum * 0.5) {
            return 10;
        }
        return 0;
    }

    private static int countMatched(Set<NormalizedSkill> wanted, Set<NormalizedSkill> held) {
        return (int) wanted.stream().filter(skill -> SkillMatcher.matchesAny(skill, held)).count();
    }
}
