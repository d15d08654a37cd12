package com.ospicorp.opscopilot.web;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.opscopilot.analytics.model.TableView;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes a {@link TableView} as {@code text/csv}: a header from the view's columns, then
 * one record per row in column order.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<TableView> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");
  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return TableView.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected TableView readInternal(@NonNull Class<? extends TableView> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull TableView view, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    CsvSchema.Builder builder = CsvSchema.builder();
    view.columns().forEach(builder::addColumn);
    CsvSchema schema = builder.setUseHeader(true).build();
    SequenceWriter writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Map<String, Object> row : view.rows()) {
      List<Object> record = new ArrayList<>(view.columns().size());
      for (String column : view.columns()) {
        record.add(row.get(column));
      }
      writer.write(record);
    }
    writer.flush();
  }
}
