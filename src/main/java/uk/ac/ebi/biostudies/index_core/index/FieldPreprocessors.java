package uk.ac.ebi.biostudies.index_core.index;

import java.util.EnumSet;
import java.util.OptionalDouble;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import uk.ac.ebi.biostudies.index_core.analysis.AnalyzerManager;
import uk.ac.ebi.biostudies.index_core.analysis.TextTokenizer;
import uk.ac.ebi.biostudies.index_core.analysis.TokenizeOption;
import uk.ac.ebi.biostudies.index_core.analysis.analyzers.FullTextAnalyzer;
import uk.ac.ebi.biostudies.index_core.exceptions.IndexingException;
import uk.ac.ebi.biostudies.index_core.exceptions.QueryErrorCode;
import uk.ac.ebi.biostudies.index_core.registry.model.FieldSpec;
import uk.ac.ebi.biostudies.index_core.registry.model.IndexFieldType;
import uk.ac.ebi.biostudies.index_core.store.document.ByteOffsets;
import uk.ac.ebi.biostudies.index_core.store.tag.TagIndex;

/**
 * Per-type field preprocessors. Each one turns the raw text of a field into the value its committer
 * needs, storing it in the field's {@link FieldIndexerData} and, for sortable fields, in the sort
 * vector. Preprocessors never touch the index store.
 */
@Component
public class FieldPreprocessors {

  private static final String GEO_SEPARATORS = " ,";

  private final AnalyzerManager analyzerManager;

  public FieldPreprocessors(AnalyzerManager analyzerManager) {
    this.analyzerManager = analyzerManager;
  }

  /**
   * Runs the preprocessor of one type over a field.
   *
   * @throws IndexingException with the typed error of the failing preprocessor
   */
  public void preprocess(
      IndexFieldType type,
      AddDocumentContext ctx,
      DocumentField field,
      FieldSpec fs,
      FieldIndexerData data) {
    switch (type) {
      case FULLTEXT -> fulltext(ctx, field, fs);
      case NUMERIC -> numeric(ctx, field, fs, data);
      case GEO -> geo(field, data);
      case TAG -> tag(ctx, field, fs, data);
      default -> throw new IndexingException(
          QueryErrorCode.GENERIC, "BUG: invalid index type " + type);
    }
  }

  void fulltext(AddDocumentContext ctx, DocumentField field, FieldSpec fs) {
    String text = field.getText();
    if (fs.isSortable()) {
      ctx.getSortVector().putString(fs.getSortIndex(), text);
    }
    if (!fs.isIndexable()) {
      return;
    }

    Set<TokenizeOption> options = EnumSet.noneOf(TokenizeOption.class);
    if (fs.isNoStem()) {
      options.add(TokenizeOption.NO_STEM);
    }
    if (fs.isPhonetics()) {
      options.add(TokenizeOption.PHONETICS);
    }
    FullTextAnalyzer analyzer =
        analyzerManager.getAnalyzer(options, ctx.getDocument().getLanguage());

    ForwardIndex forwardIndex = ctx.getForwardIndex();
    ByteOffsets byteOffsets = ctx.getByteOffsets();
    int[] lastOffsetPosition = {ctx.getTotalTokens()};
    int lastTokPos =
        TextTokenizer.tokenize(
            analyzer,
            fs.getName(),
            text,
            ctx.getTotalTokens(),
            (term, position, byteOffset) -> {
              forwardIndex.add(term, fs.getFtId(), fs.getFtWeight(), position);
              if (byteOffsets != null && position > lastOffsetPosition[0]) {
                byteOffsets.addTokenOffset(byteOffset);
                lastOffsetPosition[0] = position;
              }
            });

    if (byteOffsets != null) {
      byteOffsets.addField(fs.getFtId(), ctx.getTotalTokens() + 1, lastTokPos);
    }
    ctx.setTotalTokens(lastTokPos);
  }

  void numeric(AddDocumentContext ctx, DocumentField field, FieldSpec fs, FieldIndexerData data) {
    OptionalDouble value = NumericParser.parse(field.getText());
    if (value.isEmpty()) {
      throw new IndexingException(
          QueryErrorCode.NOT_NUMERIC,
          "Could not convert value of field " + fs.getName() + " to a number");
    }
    data.setNumeric(value.getAsDouble());
    if (fs.isSortable()) {
      ctx.getSortVector().putNumber(fs.getSortIndex(), value.getAsDouble());
    }
  }

  void geo(DocumentField field, FieldIndexerData data) {
    String text = field.getText();
    int pos = StringUtils.indexOfAny(text, GEO_SEPARATORS);
    if (pos < 0) {
      throw new IndexingException(
          QueryErrorCode.GEO_FORMAT, "Invalid geo string for field " + field.getName());
    }
    data.setGeoLongitude(text.substring(0, pos));
    data.setGeoLatitude(text.substring(pos + 1));
  }

  void tag(AddDocumentContext ctx, DocumentField field, FieldSpec fs, FieldIndexerData data) {
    data.setTags(
        TagIndex.splitTags(field.getText(), fs.getTagSeparator(), fs.isTagCaseSensitive()));
    if (!data.hasTags()) {
      return;
    }
    if (fs.isSortable()) {
      ctx.getSortVector().putString(fs.getSortIndex(), field.getText());
    }
  }
}
