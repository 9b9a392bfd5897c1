package com.pkgmeta.core.normalize;

import com.pkgmeta.core.metadata.AttributeResolver;
import com.pkgmeta.core.metadata.MetadataSource;
import com.pkgmeta.core.model.Party;
import com.pkgmeta.core.model.PartyRole;
import com.pkgmeta.core.model.PartyType;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts author and maintainer parties.
 *
 * <p>Name and email are looked up independently; a party is emitted when at
 * least one of them is present. Authors come before maintainers and identical
 * name/email pairs in both roles are kept as two parties.
 */
public final class PartyExtractor {

    private PartyExtractor() {
        // Utility class
    }

    /**
     * @param source metadata source
     * @return zero to two parties
     */
    public static List<Party> extract(MetadataSource source) {
        List<Party> parties = new ArrayList<>(2);
        addParty(parties, source, PartyRole.AUTHOR, "Author", "Author-email");
        addParty(parties, source, PartyRole.MAINTAINER, "Maintainer", "Maintainer-email");
        return parties;
    }

    private static void addParty(List<Party> parties, MetadataSource source, PartyRole role,
                                 String nameField, String emailField) {
        String name = AttributeResolver.getString(source, nameField);
        String email = AttributeResolver.getString(source, emailField);
        if (name != null || email != null) {
            parties.add(new Party(PartyType.PERSON, name, role, email));
        }
    }
}
