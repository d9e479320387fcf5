package dev.shortlist.pattern;

import dev.shortlist.model.ContractType;
import dev.shortlist.model.Seniority;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Bilingual (French and English) tables for résumés and job descriptions.
 */
@Component
public class DefaultPatternLibrary implements PatternLibrary {

    public static final String VERSION = "1";

    private static final String YEARS_UNIT = "(?:ans?|années?|years?|yrs?)";
    private static final String ONGOING = "(?i:présent|present|aujourd'hui|aujourd’hui|now|current|actuel)";

    private static final List<SkillDefinition> SKILLS = List.of(
            SkillDefinition.of("python", "Python", "python"),
            SkillDefinition.of("java", "Java", "java"),
            SkillDefinition.of("javascript", "JavaScript", "javascript"),
            SkillDefinition.of("typescript", "TypeScript", "typescript"),
            SkillDefinition.of("c++", "C++", "c++"),
            SkillDefinition.of("c#", "C#", "c#"),
            SkillDefinition.of("go", "Go", "golang"),
            SkillDefinition.of("scala", "Scala", "scala"),
            SkillDefinition.of("php", "PHP", "php"),
            SkillDefinition.of("sql", "SQL", "sql"),
            SkillDefinition.of("nosql", "NoSQL", "nosql"),
            SkillDefinition.of("postgresql", "PostgreSQL", "postgresql", "postgres"),
            SkillDefinition.of("mysql", "MySQL", "mysql"),
            SkillDefinition.of("mongodb", "MongoDB", "mongodb", "mongo"),
            SkillDefinition.of("redis", "Redis", "redis"),
            SkillDefinition.of("elasticsearch", "Elasticsearch", "elasticsearch"),
            SkillDefinition.of("scikit learn", "Scikit-learn", "scikit learn", "sklearn"),
            SkillDefinition.of("tensorflow", "TensorFlow", "tensorflow"),
            SkillDefinition.of("pytorch", "PyTorch", "pytorch"),
            SkillDefinition.of("keras", "Keras", "keras"),
            SkillDefinition.of("pandas", "Pandas", "pandas"),
            SkillDefinition.of("numpy", "NumPy", "numpy"),
            SkillDefinition.of("spark", "Apache Spark", "apache spark", "pyspark", "spark"),
            SkillDefinition.of("hadoop", "Hadoop", "hadoop"),
            SkillDefinition.of("kafka", "Kafka", "kafka"),
            SkillDefinition.of("airflow", "Apache Airflow", "apache airflow", "airflow"),
            SkillDefinition.of("dbt", "dbt", "dbt"),
            SkillDefinition.of("snowflake", "Snowflake", "snowflake"),
            SkillDefinition.of("machine learning", "Machine Learning", "machine learning", "ml"),
            SkillDefinition.of("deep learning", "Deep Learning", "deep learning"),
            SkillDefinition.of("nlp", "NLP", "nlp", "natural language processing"),
            SkillDefinition.of("computer vision", "Computer Vision", "computer vision"),
            SkillDefinition.of("artificial intelligence", "Artificial Intelligence",
                    "artificial intelligence", "intelligence artificielle", "ai"),
            SkillDefinition.of("mlops", "MLOps", "mlops"),
            SkillDefinition.of("statistics", "Statistics", "statistics", "statistiques"),
            SkillDefinition.of("power bi", "Power BI", "power bi", "powerbi"),
            SkillDefinition.of("tableau", "Tableau", "tableau"),
            SkillDefinition.of("excel", "Excel", "excel"),
            SkillDefinition.of("docker", "Docker", "docker"),
            SkillDefinition.of("kubernetes", "Kubernetes", "kubernetes", "k8s"),
            SkillDefinition.of("terraform", "Terraform", "terraform"),
            SkillDefinition.of("aws", "AWS", "aws", "amazon web services"),
            SkillDefinition.of("azure", "Azure", "azure"),
            SkillDefinition.of("gcp", "GCP", "gcp", "google cloud platform", "google cloud"),
            SkillDefinition.of("git", "Git", "git"),
            SkillDefinition.of("ci/cd", "CI/CD", "ci/cd", "cicd", "ci cd"),
            SkillDefinition.of("linux", "Linux", "linux"),
            SkillDefinition.of("spring boot", "Spring Boot", "spring boot"),
            SkillDefinition.of("spring", "Spring", "spring"),
            SkillDefinition.of("react", "React", "react", "reactjs"),
            SkillDefinition.of("angular", "Angular", "angular"),
            SkillDefinition.of("node js", "Node.js", "node js", "nodejs"),
            SkillDefinition.of("django", "Django", "django"),
            SkillDefinition.of("flask", "Flask", "flask"),
            SkillDefinition.of("fastapi", "FastAPI", "fastapi"),
            SkillDefinition.of("html", "HTML", "html"),
            SkillDefinition.of("css", "CSS", "css"),
            SkillDefinition.of("agile", "Agile", "agile"),
            SkillDefinition.of("scrum", "Scrum", "scrum"));

    private static final Set<String> CORE_SKILLS = Set.of(
            "python", "sql", "scikit learn", "tensorflow", "pytorch",
            "spark", "hadoop", "postgresql", "mongodb", "git");

    private static final Map<String, List<String>> LANGUAGES = ordered(List.of(
            Map.entry("Français", List.of("français", "francais", "french", "francophone")),
            Map.entry("Anglais", List.of("anglais", "english", "anglophone")),
            Map.entry("Espagnol", List.of("espagnol", "spanish", "español", "hispanophone")),
            Map.entry("Allemand", List.of("allemand", "german", "deutsch", "germanophone")),
            Map.entry("Italien", List.of("italien", "italian", "italiano")),
            Map.entry("Chinois", List.of("chinois", "chinese", "mandarin"))));

    private final JobPatterns jobPatterns;
    private final ResumePatterns resumePatterns;
    private final SoftSkillPatterns softSkillPatterns;

    public DefaultPatternLibrary() {
        this.jobPatterns = buildJobPatterns();
        this.resumePatterns = buildResumePatterns();
        this.softSkillPatterns = buildSoftSkillPatterns();
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public List<SkillDefinition> skills() {
        return SKILLS;
    }

    @Override
    public Set<String> coreSkills() {
        return CORE_SKILLS;
    }

    @Override
    public Map<String, List<String>> languages() {
        return LANGUAGES;
    }

    @Override
    public JobPatterns job() {
        return jobPatterns;
    }

    @Override
    public ResumePatterns resume() {
        return resumePatterns;
    }

    @Override
    public SoftSkillPatterns softSkills() {
        return softSkillPatterns;
    }

    private static JobPatterns buildJobPatterns() {
        return JobPatterns.builder()
                .titles(List.of(
                        "data scientist", "data engineer", "data analyst",
                        "machine learning engineer", "ml engineer",
                        "développeur", "developpeur", "developer",
                        "ingénieur", "ingenieur", "engineer",
                        "product manager", "project manager",
                        "qa engineer", "test engineer", "quality assurance",
                        "devops engineer", "cloud engineer",
                        "full stack", "frontend", "backend",
                        "cybersecurity", "security engineer"))
                .seniority(ordered(List.of(
                        Map.entry(Seniority.SENIOR, List.of("senior", "sénior", "expérimenté", "experienced", "expert")),
                        Map.entry(Seniority.JUNIOR, List.of("junior", "débutant", "entry level", "stagiaire", "graduate")),
                        Map.entry(Seniority.MID, List.of("mid", "confirmé", "intermédiaire", "intermediate")))))
                .experiencePatterns(List.of(
                        Pattern.compile("(?<!\\d)(\\d{1,2})\\s*\\+?\\s*(?:ans?|années?)\\s*(?:d['’\\s]\\s*|de\\s+)exp[ée]rience"),
                        Pattern.compile("(?:minimum|au moins|at least)\\s*(?:de\\s+)?(\\d{1,2})\\s*\\+?\\s*" + YEARS_UNIT),
                        Pattern.compile("(?<!\\d)(\\d{1,2})\\s*\\+?\\s*(?:years?|yrs?)")))
                .experienceRange(Pattern.compile("(?<!\\d)(\\d{1,2})\\s*(?:-|–|to|à)\\s*(\\d{1,2})\\s*" + YEARS_UNIT))
                .requiredSections(List.of(
                        "compétences techniques requises", "compétences requises", "required skills",
                        "requirements", "requis", "obligatoire", "must have", "must-have",
                        "nécessaire", "exigences"))
                .optionalSections(List.of(
                        "compétences appréciées", "compétences optionnelles", "compétences souhaitées",
                        "nice to have", "nice-to-have", "optionnel", "souhaitable", "bonus",
                        "apprécié", "preferred qualifications", "preferred"))
                .otherSections(List.of(
                        "soft skills", "savoir-être", "langues", "languages", "avantages", "benefits",
                        "missions", "responsabilités", "responsibilities", "à propos", "about us",
                        "salaire", "salary", "rémunération", "localisation", "location", "contrat", "contract"))
                .requiredContext(List.of(
                        "requis", "required", "obligatoire", "mandatory", "must have", "nécessaire",
                        "essentiel", "essential", "maîtrise", "expérience avec", "experience with",
                        "solid", "strong"))
                .optionalContext(List.of(
                        "optionnel", "optional", "nice to have", "souhaitable", "bonus",
                        "apprécié", "un plus", "is a plus", "preferred", "serait un atout", "atout"))
                .locations(ordered(List.of(
                        Map.entry("paris", "Paris"),
                        Map.entry("lyon", "Lyon"),
                        Map.entry("marseille", "Marseille"),
                        Map.entry("toulouse", "Toulouse"),
                        Map.entry("bordeaux", "Bordeaux"),
                        Map.entry("lille", "Lille"),
                        Map.entry("nantes", "Nantes"),
                        Map.entry("remote", "Remote"),
                        Map.entry("télétravail", "Remote"))))
                .locationLine(Pattern.compile("(?im)^\\s*(?:location|localisation|lieu|ville)\\s*:\\s*(.+?)\\s*$"))
                .salaryPatterns(List.of(
                        new SalaryPattern(Pattern.compile(
                                "(\\d{1,7})(k)?(?:€|eur)?(?:-|–|à|to)(\\d{1,7})(k)?(?:€|eur|euros)"), true),
                        new SalaryPattern(Pattern.compile("(\\d{1,7})(k)?€?/(?:an|year|yr)"), false),
                        new SalaryPattern(Pattern.compile("(?:salaire|salary|rémunération):(\\d{1,7})(k)?"), false)))
                .contracts(ordered(List.of(
                        Map.entry(ContractType.PERMANENT, List.of("cdi", "permanent")),
                        Map.entry(ContractType.FIXED_TERM, List.of("cdd", "temporary", "temporaire", "fixed-term")),
                        Map.entry(ContractType.INTERNSHIP, List.of("stage", "internship", "stagiaire", "intern")),
                        Map.entry(ContractType.APPRENTICESHIP, List.of("alternance", "apprentissage", "apprenticeship")),
                        Map.entry(ContractType.FREELANCE, List.of("freelance", "consultant", "indépendant", "contractor")))))
                .stopwords(Set.of(
                        "dans", "pour", "avec", "sont", "cette", "plus", "tous", "toutes", "nous", "vous",
                        "votre", "notre", "leur", "leurs", "être", "avoir", "comme", "mais", "aussi", "ainsi",
                        "with", "that", "this", "from", "have", "will", "your", "their", "they", "about",
                        "into", "what", "when", "which", "also", "more", "than", "such"))
                .build();
    }

    private static ResumePatterns buildResumePatterns() {
        return ResumePatterns.builder()
                .nameDecorations(List.of(
                        Pattern.compile("^\\s*[A-Z\\s]+\\s*\\|\\s*"),
                        Pattern.compile("\\s*\\|\\s*[A-Z\\s]+$"),
                        Pattern.compile("^[A-Z\\s]+\\s*-\\s*")))
                .email(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"))
                .phones(List.of(
                        Pattern.compile("\\b0[1-9](?:[.\\s-]?\\d{2}){4}\\b"),
                        Pattern.compile("\\+\\d{1,3}[\\s.-]?\\d{1,4}[\\s.-]?\\d{1,4}[\\s.-]?\\d{1,9}")))
                .experienceSections(List.of(
                        "expérience professionnelle", "expériences professionnelles", "work experience",
                        "professional experience", "expérience", "experience", "parcours", "carrière"))
                .experienceWithParentheses(Pattern.compile(
                        "([A-Z][^.\\n(]{10,60}?)\\s*\\((\\d{4})\\s*[-–]\\s*(\\d{4}|" + ONGOING + ")\\)"))
                .experienceWithDash(Pattern.compile(
                        "([A-Z][^.\\n]{10,60}?)\\s*[-–]\\s*(\\d{4}|\\d{1,2}/\\d{4})"
                                + "(?:\\s*[-–]\\s*(\\d{4}|\\d{1,2}/\\d{4}|" + ONGOING + "))?"))
                .ongoingMarkers(List.of("présent", "present", "aujourd'hui", "aujourd’hui", "now", "current", "actuel"))
                .educationSections(List.of("formation", "éducation", "education", "diplômes", "diplôme", "études"))
                .educationPatterns(List.of(
                        Pattern.compile("(?:Master|Licence|Bachelor|Bac|Doctorat|PhD|MBA|BTS|DUT|Ingénieur"
                                + "|École|Ecole|Université|University)[^.\\n]{0,100}"),
                        Pattern.compile("([A-Z][^.\\n]{10,60}?)\\s*[-–]\\s*(\\d{4})")))
                .build();
    }

    private static SoftSkillPatterns buildSoftSkillPatterns() {
        return SoftSkillPatterns.builder()
                .motivationPositive(List.of(
                        "passionné", "motivé", "enthousiaste", "intéressé", "souhaite", "désire",
                        "ambition", "défi", "apprendre", "développer", "progresser", "évoluer",
                        "contribution", "apporter", "participer", "collaborer",
                        "passionate", "motivated", "enthusiastic", "eager", "excited", "challenge",
                        "learn", "contribute", "grow"))
                .motivationNegative(List.of("cherche", "disponible", "urgent", "n'importe quel", "any job"))
                .salutations(List.of("objet", "madame", "monsieur", "dear", "subject"))
                .closings(List.of("respectueusement", "cordialement", "sincèrement", "sincerely",
                        "best regards", "kind regards"))
                .resumeSections(ordered(List.of(
                        Map.entry("experience", List.of("expérience", "experience")),
                        Map.entry("education", List.of("formation", "education")),
                        Map.entry("skills", List.of("compétences", "skills")),
                        Map.entry("languages", List.of("langues", "languages")))))
                .leadership(List.of(
                        "manager", "chef", "responsable", "directeur", "lead", "équipe", "encadrer",
                        "superviser", "coordonner", "piloter", "team", "supervise", "mentor"))
                .leadershipTitles(List.of("manager", "chef", "responsable", "directeur", "director", "lead", "head"))
                .tags(ordered(List.of(
                        Map.entry("teamwork", List.of("travail d'équipe", "teamwork", "collaboration", "collaboratif")),
                        Map.entry("communication", List.of("communication", "communicationnel", "communiquer")),
                        Map.entry("leadership", List.of("leadership", "diriger", "management", "gérer", "encadrer")),
                        Map.entry("autonomy", List.of("autonome", "autonomie", "indépendant", "autonomous")),
                        Map.entry("adaptability", List.of("adaptable", "adaptabilité", "flexible", "polyvalent")),
                        Map.entry("creativity", List.of("créatif", "créativité", "innovation", "innovant", "creative")),
                        Map.entry("problem solving", List.of("résolution", "problème", "problem solving", "défi")),
                        Map.entry("time management", List.of("gestion du temps", "organisation", "organisé",
                                "planification", "time management")),
                        Map.entry("team spirit", List.of("esprit d'équipe", "coopération", "coopératif")),
                        Map.entry("motivation", List.of("motivé", "motivation", "déterminé", "persévérant",
                                "motivated")))))
                .build();
    }

    private static <K, V> Map<K, V> ordered(List<Map.Entry<K, V>> entries) {
        Map<K, V> map = new LinkedHashMap<>();
        entries.forEach(entry -> map.put(entry.getKey(), entry.getValue()));
        return Collections.unmodifiableMap(map);
    }
}
