package com.aknmodel.core.document.impl;

import com.aknmodel.core.document.DocumentType;
import com.aknmodel.core.document.DocumentTypeProvider;
import com.aknmodel.core.document.impl.amendment.Amendment;
import com.aknmodel.core.document.impl.collection.AmendmentList;
import com.aknmodel.core.document.impl.collection.Collection;
import com.aknmodel.core.document.impl.collection.DocumentCollection;
import com.aknmodel.core.document.impl.collection.OfficialGazette;
import com.aknmodel.core.document.impl.debate.Debate;
import com.aknmodel.core.document.impl.hierarchical.Act;
import com.aknmodel.core.document.impl.hierarchical.Bill;
import com.aknmodel.core.document.impl.judgment.Judgment;
import com.aknmodel.core.document.impl.open.DebateReport;
import com.aknmodel.core.document.impl.open.Doc;
import com.aknmodel.core.document.impl.open.Statement;
import com.aknmodel.core.document.impl.portion.Portion;

import java.util.List;

/**
 * Registers the document types defined by the Akoma Ntoso standard, grouped by
 * structure type.
 */
public class StandardDocumentTypes implements DocumentTypeProvider {

    @Override
    public List<DocumentType<?>> documentTypes() {
        return List.of(
            // hierarchicalStructure
            Act.TYPE,
            Bill.TYPE,
            // collectionStructure
            Collection.TYPE,
            AmendmentList.TYPE,
            OfficialGazette.TYPE,
            DocumentCollection.TYPE,
            // openStructure
            Doc.TYPE,
            Statement.TYPE,
            DebateReport.TYPE,
            // debateStructure
            Debate.TYPE,
            // judgmentStructure
            Judgment.TYPE,
            // amendmentStructure
            Amendment.TYPE,
            // portionStructure
            Portion.TYPE
        );
    }
}
