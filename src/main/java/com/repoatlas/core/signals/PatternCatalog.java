package com.repoatlas.core.signals;

import com.repoatlas.core.model.FileCategory;
import com.repoatlas.core.model.SignalCategory;

import java.util.List;
import java.util.Set;

import static com.repoatlas.core.model.FileCategory.BACKEND;
import static com.repoatlas.core.model.FileCategory.FRONTEND;
import static com.repoatlas.core.model.FileCategory.SHARED;
import static com.repoatlas.core.model.SignalCategory.AUTH;
import static com.repoatlas.core.model.SignalCategory.DATA_FETCHING;
import static com.repoatlas.core.model.SignalCategory.ORM;
import static com.repoatlas.core.model.SignalCategory.ROUTING;
import static com.repoatlas.core.model.SignalCategory.STATE_MANAGEMENT;
import static com.repoatlas.core.model.SignalCategory.TESTING;

/**
 * Declarative, ordered table of technology signatures. Every group whose scope admits
 * the file is evaluated; a file may report several values for one category.
 */
public final class PatternCatalog {

    private static final Set<FileCategory> FRONTEND_ONLY = Set.of(FRONTEND);
    private static final Set<FileCategory> CLIENT_SIDE = Set.of(FRONTEND, SHARED);
    private static final Set<FileCategory> SERVER_SIDE = Set.of(BACKEND, SHARED);
    private static final Set<FileCategory> ANY_CODE = Set.of(FRONTEND, BACKEND, SHARED);

    public static final List<PatternGroup> DEFAULT_GROUPS = List.of(
            // State management is a frontend idiom; backend files never report it
            PatternGroup.of(STATE_MANAGEMENT, "redux", FRONTEND_ONLY,
                    "from\\s+['\"](redux|@reduxjs/toolkit|react-redux)['\"]", "\\bcreateSlice\\s*\\(", "\\bconfigureStore\\s*\\("),
            PatternGroup.of(STATE_MANAGEMENT, "zustand", FRONTEND_ONLY,
                    "from\\s+['\"]zustand(/[\\w-]+)?['\"]"),
            PatternGroup.of(STATE_MANAGEMENT, "pinia", FRONTEND_ONLY,
                    "from\\s+['\"]pinia['\"]", "\\bdefineStore\\s*\\("),
            PatternGroup.of(STATE_MANAGEMENT, "mobx", FRONTEND_ONLY,
                    "from\\s+['\"]mobx(-react(-lite)?)?['\"]"),
            PatternGroup.of(STATE_MANAGEMENT, "context-api", FRONTEND_ONLY,
                    "\\bcreateContext\\s*[<(]"),
            PatternGroup.of(STATE_MANAGEMENT, "useReducer", FRONTEND_ONLY,
                    "\\buseReducer\\s*[<(]"),
            PatternGroup.of(STATE_MANAGEMENT, "useState", FRONTEND_ONLY,
                    "\\buseState\\s*[<(]"),

            PatternGroup.of(DATA_FETCHING, "react-query", CLIENT_SIDE,
                    "['\"]@tanstack/(react|vue)-query['\"]", "['\"]react-query['\"]", "\\buseQuery\\s*[<(]"),
            PatternGroup.of(DATA_FETCHING, "swr", CLIENT_SIDE,
                    "from\\s+['\"]swr['\"]", "\\buseSWR\\s*[<(]"),
            PatternGroup.of(DATA_FETCHING, "apollo", CLIENT_SIDE,
                    "['\"]@apollo/client['\"]"),
            PatternGroup.of(DATA_FETCHING, "axios", CLIENT_SIDE,
                    "from\\s+['\"]axios['\"]", "require\\(\\s*['\"]axios['\"]\\s*\\)",
                    "\\baxios\\.(get|post|put|delete|patch|create)\\s*\\("),
            PatternGroup.of(DATA_FETCHING, "fetch", CLIENT_SIDE,
                    "(?<![\\w.])fetch\\s*\\("),

            PatternGroup.of(ROUTING, "express-router", SERVER_SIDE,
                    "\\bexpress\\.Router\\s*\\(", "\\b(app|router)\\.(get|post|put|delete|patch)\\s*\\(\\s*['\"`]/"),
            PatternGroup.of(ROUTING, "nextjs-router", CLIENT_SIDE,
                    "from\\s+['\"]next/(navigation|router|link)['\"]"),
            PatternGroup.of(ROUTING, "react-router", FRONTEND_ONLY,
                    "from\\s+['\"]react-router(-dom)?['\"]"),
            PatternGroup.of(ROUTING, "vue-router", FRONTEND_ONLY,
                    "from\\s+['\"]vue-router['\"]"),
            PatternGroup.of(ROUTING, "fastapi", Set.of(BACKEND),
                    "from\\s+fastapi\\s+import", "\\bAPIRouter\\s*\\("),
            PatternGroup.of(ROUTING, "flask", Set.of(BACKEND),
                    "from\\s+flask\\s+import", "\\bBlueprint\\s*\\("),
            PatternGroup.of(ROUTING, "django-urls", Set.of(BACKEND),
                    "from\\s+django\\.urls\\s+import", "\\burlpatterns\\s*="),
            PatternGroup.of(ROUTING, "spring-mvc", Set.of(BACKEND),
                    "@(RestController|Controller|RequestMapping|GetMapping|PostMapping)\\b"),

            PatternGroup.of(ORM, "mongoose", SERVER_SIDE,
                    "require\\(\\s*['\"]mongoose['\"]\\s*\\)", "from\\s+['\"]mongoose['\"]",
                    "\\bnew\\s+(mongoose\\.)?Schema\\s*\\("),
            PatternGroup.of(ORM, "prisma", SERVER_SIDE,
                    "['\"]@prisma/client['\"]", "\\bnew\\s+PrismaClient\\s*\\("),
            PatternGroup.of(ORM, "typeorm", SERVER_SIDE,
                    "from\\s+['\"]typeorm['\"]"),
            PatternGroup.of(ORM, "sequelize", SERVER_SIDE,
                    "from\\s+['\"]sequelize['\"]", "require\\(\\s*['\"]sequelize['\"]\\s*\\)",
                    "\\bsequelize\\.define\\s*\\(", "\\bDataTypes\\.[A-Z]+"),
            PatternGroup.of(ORM, "sqlalchemy", Set.of(BACKEND),
                    "(?m)^\\s*(from|import)\\s+(flask_)?sqlalchemy\\b"),
            PatternGroup.of(ORM, "django-orm", Set.of(BACKEND),
                    "from\\s+django\\.db\\s+import\\s+models", "\\bmodels\\.Model\\b"),
            PatternGroup.of(ORM, "jpa", Set.of(BACKEND),
                    "import\\s+(jakarta|javax)\\.persistence\\.", "\\bextends\\s+JpaRepository\\b"),
            PatternGroup.of(ORM, "raw-queries", SERVER_SIDE,
                    "\\bSELECT\\s+[\\w*,\\s.]+\\s+FROM\\s+\\w+", "\\bINSERT\\s+INTO\\s+\\w+", "\\bUPDATE\\s+\\w+\\s+SET\\b"),

            PatternGroup.of(AUTH, "jwt", ANY_CODE,
                    "['\"]jsonwebtoken['\"]", "\\bjwt\\.(sign|verify|decode|encode)\\s*\\(", "(?m)^\\s*import\\s+jwt\\b", "\\bio\\.jsonwebtoken\\b"),
            PatternGroup.of(AUTH, "session", SERVER_SIDE,
                    "['\"]express-session['\"]", "\\breq\\.session\\b", "\\bSessionMiddleware\\b"),
            PatternGroup.of(AUTH, "passport", SERVER_SIDE,
                    "require\\(\\s*['\"]passport['\"]\\s*\\)", "from\\s+['\"]passport['\"]"),
            PatternGroup.of(AUTH, "oauth", ANY_CODE,
                    "(?i)passport-(google|github)-?oauth", "(?i)\\boauth2?(client|provider|_client|\\.)", "['\"]next-auth(/[\\w-]+)?['\"]"),
            PatternGroup.of(AUTH, "spring-security", Set.of(BACKEND),
                    "import\\s+org\\.springframework\\.security\\."),

            PatternGroup.of(TESTING, "jest", CLIENT_SIDE,
                    "from\\s+['\"]@jest/globals['\"]", "\\bjest\\.(fn|mock|spyOn)\\s*\\("),
            PatternGroup.of(TESTING, "vitest", CLIENT_SIDE,
                    "from\\s+['\"]vitest['\"]"),
            PatternGroup.of(TESTING, "pytest", Set.of(BACKEND),
                    "(?m)^\\s*import\\s+pytest\\b", "@pytest\\.fixture"),
            PatternGroup.of(TESTING, "junit", Set.of(BACKEND),
                    "import\\s+org\\.junit\\.")
    );

    private PatternCatalog() {} // utility class
}
